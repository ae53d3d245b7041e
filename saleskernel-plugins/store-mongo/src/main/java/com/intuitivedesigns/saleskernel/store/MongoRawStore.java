/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.store;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.core.RawStore;
import com.intuitivedesigns.saleskernel.metrics.MetricsRuntime;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Projections;
import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Raw sale documents in one MongoDB collection, replaced wholesale on every run.
 *
 * <p>Each stored document carries an {@code _metadata} sub-document
 * ({@code ingestion_timestamp}, {@code origin}, {@code pipeline_version}). Reads strip it
 * together with {@code _id}, so what comes back is what went in.</p>
 */
public final class MongoRawStore implements RawStore<Map<String, Object>> {

    private static final Logger log = LoggerFactory.getLogger(MongoRawStore.class);

    // Config keys
    public static final String KEY_URI = "mongodb.uri";
    public static final String KEY_DATABASE = "mongodb.database";
    public static final String KEY_COLLECTION = "mongodb.collection";
    public static final String KEY_SERVER_SELECTION_TIMEOUT_MS = "mongodb.server.selection.timeout.ms";
    public static final String KEY_PIPELINE_VERSION = "pipeline.version";

    // Defaults
    public static final String DEFAULT_DATABASE = "analytics";
    public static final String DEFAULT_COLLECTION = "raw_sales";
    public static final long DEFAULT_SERVER_SELECTION_TIMEOUT_MS = 5000L;
    public static final String DEFAULT_PIPELINE_VERSION = "1.0";

    static final String METADATA_FIELD = "_metadata";
    static final String ORIGIN = "external_api";

    private static final Bson STRIP_INTERNAL = Projections.exclude("_id", METADATA_FIELD);

    private final MongoClient client;
    private final MongoCollection<Document> collection;
    private final MetricsRuntime metrics;
    private final Clock clock;
    private final String pipelineVersion;

    /**
     * @param client owned client closed by {@link #close()}, or {@code null} when the caller owns it
     */
    public MongoRawStore(MongoClient client,
                         MongoCollection<Document> collection,
                         MetricsRuntime metrics,
                         Clock clock,
                         String pipelineVersion) {
        this.client = client;
        this.collection = Objects.requireNonNull(collection, "collection");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pipelineVersion = Objects.requireNonNull(pipelineVersion, "pipelineVersion");
    }

    public static MongoRawStore fromConfig(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String uri = config.require(KEY_URI);
        final String dbName = config.getString(KEY_DATABASE, DEFAULT_DATABASE);
        final String colName = config.getString(KEY_COLLECTION, DEFAULT_COLLECTION);
        final long selectionTimeoutMs = config.getLong(KEY_SERVER_SELECTION_TIMEOUT_MS, DEFAULT_SERVER_SELECTION_TIMEOUT_MS);

        final MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(uri))
                .applyToClusterSettings(builder ->
                        builder.serverSelectionTimeout(selectionTimeoutMs, TimeUnit.MILLISECONDS))
                .build();

        final MongoClient client = MongoClients.create(settings);
        final MongoCollection<Document> col = client.getDatabase(dbName).getCollection(colName);

        log.info("✅ MongoDB Raw Store Active: {}/{}", dbName, colName);
        return new MongoRawStore(client, col, metrics, Clock.systemUTC(),
                config.getString(KEY_PIPELINE_VERSION, DEFAULT_PIPELINE_VERSION));
    }

    @Override
    public int replaceAll(List<Map<String, Object>> records) throws RawStoreException {
        try {
            final DeleteResult deleted = collection.deleteMany(new Document());
            log.info("Cleared {} previous raw documents from {}", deleted.getDeletedCount(), collectionName());

            if (records == null || records.isEmpty()) {
                log.warn("No raw records to store.");
                return 0;
            }

            final Document metadata = new Document("ingestion_timestamp", Date.from(clock.instant()))
                    .append("origin", ORIGIN)
                    .append("pipeline_version", pipelineVersion);

            final List<Document> docs = new ArrayList<>(records.size());
            for (Map<String, Object> r : records) {
                if (r == null) continue;
                final Document doc = new Document(r);
                doc.put(METADATA_FIELD, new Document(metadata));
                docs.add(doc);
            }
            if (docs.isEmpty()) {
                return 0;
            }

            collection.insertMany(docs);
            metrics.counter("rawstore.mongo.documents", docs.size());
            log.info("Stored {} raw documents in {}", docs.size(), collectionName());
            return docs.size();
        } catch (MongoException e) {
            log.error("❌ MongoDB write to {} failed: {}", collectionName(), e.getMessage());
            throw new RawStoreException("MongoDB write failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Map<String, Object>> readAll() throws RawStoreException {
        try {
            final List<Document> docs = collection.find().projection(STRIP_INTERNAL).into(new ArrayList<>());
            final List<Map<String, Object>> out = new ArrayList<>(docs.size());
            for (Document d : docs) {
                out.add(new LinkedHashMap<>(d));
            }
            log.info("Read {} raw documents from {}", out.size(), collectionName());
            return out;
        } catch (MongoException e) {
            log.error("❌ MongoDB read from {} failed: {}", collectionName(), e.getMessage());
            throw new RawStoreException("MongoDB read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String id() {
        return MongoRawStorePlugin.ID;
    }

    @Override
    public void close() {
        if (client != null) {
            log.info("Closing MongoDB connection...");
            client.close();
        }
    }

    private String collectionName() {
        return String.valueOf(collection.getNamespace());
    }
}
