package com.sportsautobet.infrastructure.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.sportsautobet.domain.model.DailySelection;
import com.sportsautobet.domain.ports.SelectionRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Date;
import java.util.Map;

/**
 * MongoDB archive of daily selections, one document per collection date.
 */
@Repository
public class MongoSelectionRepository implements SelectionRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoSelectionRepository.class);
    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private final MongoClient mongoClient;
    private final String databaseName;
    private final String collectionName;

    public MongoSelectionRepository(
            MongoClient mongoClient,
            String selectionCollectionName,
            @Value("${mongodb.database:autobet}") String databaseName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.collectionName = selectionCollectionName;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            collection().createIndex(
                Indexes.ascending("date"),
                new IndexOptions().unique(true).background(true)
            );
            logger.info("MongoDB indexes initialized for collection: {}", collectionName);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public void save(DailySelection selection) {
        if (selection == null || selection.getDate() == null) {
            logger.warn("Not archiving a selection without a date");
            return;
        }

        Document doc = selectionToDocument(selection);
        doc.put("archivedAt", Date.from(Instant.now()));

        collection().replaceOne(
            Filters.eq("date", selection.getDate()),
            doc,
            new ReplaceOptions().upsert(true)
        );
        logger.info("Archived {} picks for {}", selection.getPicks().size(), selection.getDate());
    }

    @Override
    public DailySelection findByDate(String date) {
        if (date == null) {
            return null;
        }
        Document doc = collection().find(Filters.eq("date", date)).first();
        return doc != null ? documentToSelection(doc) : null;
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(databaseName).getCollection(collectionName);
    }

    static Document selectionToDocument(DailySelection selection) {
        @SuppressWarnings("unchecked")
        Map<String, Object> map = OBJECT_MAPPER.convertValue(selection, Map.class);
        return new Document(map);
    }

    static DailySelection documentToSelection(Document doc) {
        Document copy = new Document(doc);
        copy.remove("_id");
        copy.remove("archivedAt");
        return OBJECT_MAPPER.convertValue(copy, DailySelection.class);
    }
}
