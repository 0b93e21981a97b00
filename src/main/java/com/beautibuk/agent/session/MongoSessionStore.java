package com.beautibuk.agent.session;

import com.beautibuk.agent.exception.StorageFailureException;
import com.beautibuk.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Session store backed by MongoDB, one document per session.
 *
 * loadOrCreate is an upsert that only touches fields via $setOnInsert, so calling it
 * for an existing session changes nothing. append is a single $push/$each on the
 * session document, which MongoDB applies atomically: a turn is stored whole or not at all.
 * The cache generation is read before the store so a fill racing an append is refused.
 */
@Slf4j
public class MongoSessionStore implements SessionStore {

    private final MongoTemplate mongoTemplate;
    private final SessionCache sessionCache;
    private final Clock clock;

    public MongoSessionStore(MongoTemplate mongoTemplate, SessionCache sessionCache, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.sessionCache = sessionCache;
        this.clock = clock;
    }

    @Override
    public Session loadOrCreate(String sessionId) {
        return sessionCache.get(sessionId).orElseGet(() -> loadFromStore(sessionId));
    }

    private Session loadFromStore(String sessionId) {
        long generation = sessionCache.generation(sessionId);
        Instant now = clock.instant();
        Query query = new Query(Criteria.where("_id").is(sessionId));
        Update update = new Update()
                .setOnInsert("messages", new ArrayList<>())
                .setOnInsert("createdAt", now)
                .setOnInsert("updatedAt", now);

        Session session;
        try {
            session = mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), Session.class);
        } catch (DataAccessException e) {
            throw new StorageFailureException("Failed to load session " + sessionId, e);
        }

        if (session == null) {
            // returnNew(true) + upsert always yields a document; stay correct if a driver says otherwise
            log.warn("findAndModify returned null for session={}, using an empty session", sessionId);
            session = Session.empty(sessionId, now);
        }
        if (session.getMessages() == null) {
            session.setMessages(new ArrayList<>());
        }

        log.debug("Session loaded [sessionId={}, messages={}]", sessionId, session.getMessages().size());
        sessionCache.put(session, generation);
        return session;
    }

    @Override
    public void append(String sessionId, List<Message> messages) {
        ToolCallLedger.validateTurn(messages);
        if (messages.isEmpty()) {
            return;
        }

        Instant now = clock.instant();
        Query query = new Query(Criteria.where("_id").is(sessionId));
        Update update = new Update()
                .push("messages").each(messages.toArray())
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);

        try {
            mongoTemplate.upsert(query, update, Session.class);
        } catch (DataAccessException e) {
            throw new StorageFailureException("Failed to append to session " + sessionId, e);
        } finally {
            sessionCache.evict(sessionId);
        }

        log.debug("Appended {} messages to session {}", messages.size(), sessionId);
    }
}
