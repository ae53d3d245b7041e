/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.saleskernel.store;

import com.intuitivedesigns.saleskernel.config.PipelineConfig;
import com.intuitivedesigns.saleskernel.metrics.NoopMetricsRuntime;
import com.intuitivedesigns.saleskernel.spi.RawStorePlugin;
import com.intuitivedesigns.saleskernel.spi.ServicePluginRegistry;
import com.mongodb.MongoSocketOpenException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoRawStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:15:30Z");

    @Mock
    private MongoCollection<Document> collection;

    @Mock
    private FindIterable<Document> findIterable;

    private MongoRawStore store;

    @BeforeEach
    void setUp() {
        store = new MongoRawStore(null, collection, NoopMetricsRuntime.INSTANCE,
                Clock.fixed(NOW, ZoneOffset.UTC), "1.0");
    }

    @Test
    @SuppressWarnings("unchecked")
    void replaceAllClearsThenInsertsWithMetadata() throws Exception {
        when(collection.deleteMany(any(Bson.class))).thenReturn(DeleteResult.acknowledged(3));

        final Map<String, Object> sale = new LinkedHashMap<>();
        sale.put("id", 1);
        sale.put("Produto", "Cadeira");

        final int stored = store.replaceAll(List.of(sale));

        assertEquals(1, stored);
        final InOrder order = inOrder(collection);
        order.verify(collection).deleteMany(any(Bson.class));
        final ArgumentCaptor<List<Document>> docs = ArgumentCaptor.forClass(List.class);
        order.verify(collection).insertMany(docs.capture());

        final Document doc = docs.getValue().get(0);
        assertEquals(1, doc.get("id"));
        assertEquals("Cadeira", doc.get("Produto"));

        final Document meta = doc.get(MongoRawStore.METADATA_FIELD, Document.class);
        assertEquals(Date.from(NOW), meta.get("ingestion_timestamp"));
        assertEquals("external_api", meta.get("origin"));
        assertEquals("1.0", meta.get("pipeline_version"));

        assertFalse(sale.containsKey(MongoRawStore.METADATA_FIELD), "caller's record must not be touched");
    }

    @Test
    void replaceAllWithNoRecordsOnlyClears() throws Exception {
        when(collection.deleteMany(any(Bson.class))).thenReturn(DeleteResult.acknowledged(5));

        assertEquals(0, store.replaceAll(List.of()));

        verify(collection).deleteMany(any(Bson.class));
        verify(collection, never()).insertMany(any());
    }

    @Test
    void readAllReturnsPlainMaps() throws Exception {
        when(collection.find()).thenReturn(findIterable);
        when(findIterable.projection(any(Bson.class))).thenReturn(findIterable);
        when(findIterable.into(any())).thenAnswer(inv -> {
            final List<Document> target = inv.getArgument(0);
            target.add(new Document("id", 7).append("Preço", 49.9));
            return target;
        });

        final List<Map<String, Object>> out = store.readAll();

        assertEquals(1, out.size());
        assertInstanceOf(LinkedHashMap.class, out.get(0));
        assertEquals(7, out.get(0).get("id"));
        assertEquals(49.9, out.get(0).get("Preço"));
        verify(findIterable).projection(any(Bson.class));
    }

    @Test
    void driverFailureIsWrapped() {
        final MongoSocketOpenException boom =
                new MongoSocketOpenException("refused", new ServerAddress("localhost", 27017));
        when(collection.deleteMany(any(Bson.class))).thenThrow(boom);

        final RawStoreException ex = assertThrows(RawStoreException.class,
                () -> store.replaceAll(List.of(Map.of("id", 1))));
        assertSame(boom, ex.getCause());
        assertTrue(ex.getMessage().contains("refused"));
    }

    @Test
    void fromConfigRequiresUri() {
        assertThrows(IllegalArgumentException.class,
                () -> MongoRawStore.fromConfig(PipelineConfig.fromMap(Map.of()), NoopMetricsRuntime.INSTANCE));
    }

    @Test
    void pluginIsDiscoverable() {
        final ServicePluginRegistry<RawStorePlugin> registry =
                new ServicePluginRegistry<>(RawStorePlugin.class, getClass().getClassLoader());
        assertTrue(registry.get(MongoRawStorePlugin.ID).isPresent());
    }
}
