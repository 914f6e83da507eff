package com.example.jobqueue.backend;

import com.mongodb.client.MongoClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * MongoDB client plus a template bound to the job queue database.
 */
@Slf4j
@Getter
public class DocumentConnection implements BackendConnection {

    private final MongoClient client;
    private final MongoTemplate mongoTemplate;
    private final String database;

    public DocumentConnection(MongoClient client, String database) {
        this.client = client;
        this.database = database;
        this.mongoTemplate = new MongoTemplate(client, database);
    }

    @Override
    public BackendType getType() {
        return BackendType.MONGODB;
    }

    @Override
    public void close() {
        log.info("Closing MongoDB client for database {}", database);
        client.close();
    }
}
