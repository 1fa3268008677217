package com.javis.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.ReaderUtil;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persistent memory store on a Lucene index. Vectors are indexed as
 * {@link KnnFloatVectorField}s and every filtered candidate is scored exactly
 * with cosine similarity, so ties and small indexes rank the same way as the
 * in-memory store. Metadata is indexed per key for exact filtering and stored
 * as JSON. Searches run on near-real-time snapshots from a
 * {@link SearcherManager}, so a concurrent {@code add} is either fully visible
 * or not at all.
 */
public class LuceneMemoryStore implements MemoryStore {

    private static final Logger log = LoggerFactory.getLogger(LuceneMemoryStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String F_ID = "id";
    private static final String F_TEXT = "text";
    private static final String F_VECTOR = "vector";
    private static final String F_CREATED = "created_at";
    private static final String F_SEQ = "seq";
    private static final String F_METADATA = "metadata";
    private static final String META_PREFIX = "meta.";

    private final EmbeddingProvider embeddingProvider;
    private final FSDirectory directory;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final AtomicLong sequence;

    public LuceneMemoryStore(EmbeddingProvider embeddingProvider, String indexPath) throws IOException {
        this.embeddingProvider = embeddingProvider;
        var path = Path.of(indexPath);
        Files.createDirectories(path);
        this.directory = FSDirectory.open(path);
        var config = new IndexWriterConfig(new StandardAnalyzer());
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.writer = new IndexWriter(directory, config);
        this.searcherManager = new SearcherManager(writer, null);
        this.sequence = new AtomicLong(writer.getDocStats().maxDoc);
        log.info("Memory index opened at {} ({} records)", path, writer.getDocStats().numDocs);
    }

    @Override
    public String add(String text, Map<String, ?> metadata) {
        var vector = embeddingProvider.embed(text);
        Ranking.checkDimension(vector, embeddingProvider);
        var meta = MetadataValues.normalize(metadata);
        var id = UUID.randomUUID().toString();
        var now = Instant.now();

        try {
            var doc = new Document();
            doc.add(new StringField(F_ID, id, Field.Store.YES));
            doc.add(new StoredField(F_TEXT, text));
            // zero vectors are legal memories, which the COSINE field function rejects
            doc.add(new KnnFloatVectorField(F_VECTOR, vector, VectorSimilarityFunction.EUCLIDEAN));
            doc.add(new StoredField(F_CREATED, now.getEpochSecond() * 1_000_000_000L + now.getNano()));
            doc.add(new StoredField(F_SEQ, sequence.getAndIncrement()));
            doc.add(new StoredField(F_METADATA, MAPPER.writeValueAsString(meta)));
            for (var entry : meta.entrySet()) {
                doc.add(new StringField(META_PREFIX + entry.getKey(), String.valueOf(entry.getValue()), Field.Store.NO));
            }
            writer.addDocument(doc);
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store memory", e);
        }
        return id;
    }

    @Override
    public List<MemoryResult> search(String query, int k, Map<String, ?> filter) {
        Ranking.checkK(k);
        if (k == 0) return List.of();
        try {
            var searcher = searcherManager.acquire();
            try {
                int total = searcher.getIndexReader().numDocs();
                if (total == 0) return List.of();

                var queryVector = embeddingProvider.embed(query);
                Ranking.checkDimension(queryVector, embeddingProvider);

                var hits = searcher.search(filterQuery(filter), total);
                var stored = searcher.storedFields();
                var candidates = new ArrayList<Ranking.Candidate>(hits.scoreDocs.length);
                for (var hit : hits.scoreDocs) {
                    var doc = stored.document(hit.doc);
                    var record = toRecord(doc, vectorOf(searcher, hit.doc));
                    var score = VectorMath.cosine(queryVector, record.vectorView());
                    candidates.add(new Ranking.Candidate(record, score,
                            doc.getField(F_SEQ).numericValue().longValue()));
                }
                return Ranking.topK(candidates, k);
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            log.error("Failed to search memory", e);
            return List.of();
        }
    }

    @Override
    public Optional<MemoryRecord> get(String id) {
        try {
            var searcher = searcherManager.acquire();
            try {
                var hits = searcher.search(new TermQuery(new Term(F_ID, id)), 1);
                if (hits.scoreDocs.length == 0) return Optional.empty();
                int doc = hits.scoreDocs[0].doc;
                return Optional.of(toRecord(searcher.storedFields().document(doc), vectorOf(searcher, doc)));
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read memory " + id, e);
        }
    }

    @Override
    public boolean delete(String id) {
        var term = new Term(F_ID, id);
        try {
            boolean existed;
            IndexSearcher searcher = searcherManager.acquire();
            try {
                existed = searcher.count(new TermQuery(term)) > 0;
            } finally {
                searcherManager.release(searcher);
            }
            if (!existed) return false;
            writer.deleteDocuments(term);
            writer.commit();
            searcherManager.maybeRefreshBlocking();
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete memory " + id, e);
        }
    }

    @Override
    public int size() {
        try {
            var searcher = searcherManager.acquire();
            try {
                return searcher.getIndexReader().numDocs();
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to count memories", e);
        }
    }

    @Override
    public void close() {
        try {
            searcherManager.close();
            writer.close();
            directory.close();
        } catch (IOException e) {
            log.error("Failed to close memory store", e);
        }
    }

    private static Query filterQuery(Map<String, ?> filter) {
        if (filter == null || filter.isEmpty()) return new MatchAllDocsQuery();
        var builder = new BooleanQuery.Builder();
        filter.forEach((key, value) -> builder.add(
                new TermQuery(new Term(META_PREFIX + key, String.valueOf(value))), BooleanClause.Occur.FILTER));
        return builder.build();
    }

    private static float[] vectorOf(IndexSearcher searcher, int doc) throws IOException {
        var leaves = searcher.getIndexReader().leaves();
        var leaf = leaves.get(ReaderUtil.subIndex(doc, leaves));
        var values = leaf.reader().getFloatVectorValues(F_VECTOR);
        int target = doc - leaf.docBase;
        if (values == null || values.advance(target) != target) {
            throw new IllegalStateException("Memory document " + doc + " has no vector");
        }
        // the reader reuses its buffer
        return values.vectorValue().clone();
    }

    private static MemoryRecord toRecord(Document doc, float[] vector) throws IOException {
        long nanos = doc.getField(F_CREATED).numericValue().longValue();
        Map<String, Object> metadata = MAPPER.readValue(doc.get(F_METADATA), METADATA_TYPE);
        return new MemoryRecord(doc.get(F_ID), doc.get(F_TEXT), vector, metadata,
                Instant.ofEpochSecond(nanos / 1_000_000_000L, nanos % 1_000_000_000L));
    }
}
