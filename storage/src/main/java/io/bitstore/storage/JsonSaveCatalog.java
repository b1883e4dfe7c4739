// file: storage/src/main/java/io/bitstore/storage/JsonSaveCatalog.java
package io.bitstore.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bitstore.core.ContentHash;
import io.bitstore.core.IntegrityException;
import io.bitstore.core.NotFoundException;
import io.bitstore.core.SaveRecord;
import io.bitstore.storage.fs.FileSystem;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link SaveCatalog} stored as one JSON document ({"saves":[...]}).
 * <p>
 * Every call re-reads the document and append rewrites it whole, so two
 * processes appending at once can lose a record. Only one writer per
 * repository is supported.
 */
public final class JsonSaveCatalog implements SaveCatalog {
    static final int ID_LENGTH = 12;

    private final FileSystem fs;
    private final String file;
    private final ObjectMapper mapper = Json.mapper();

    record Document(@JsonProperty("saves") List<SaveRecord> saves) {
        Document {
            saves = saves == null ? List.of() : List.copyOf(saves);
        }
    }

    public JsonSaveCatalog(FileSystem fs, RepositoryLayout layout) {
        this.fs = fs;
        this.file = layout.catalogFile();
    }

    /** Write an empty catalog, replacing any existing document. */
    public void initialize() {
        write(new Document(List.of()));
    }

    @Override
    public String nextId(String label, Instant createdAt, List<String> files) {
        Set<String> taken = new HashSet<>();
        for (SaveRecord r : all()) taken.add(r.id());

        List<String> parts = new ArrayList<>(files.size() + 3);
        parts.add(label);
        parts.add(createdAt.toString());
        parts.addAll(files);
        String id = ContentHash.ofStrings(parts).substring(0, ID_LENGTH);

        // Same label, time and files as an existing save: salt until unique.
        for (int salt = 1; taken.contains(id); salt++) {
            parts.add("#" + salt);
            id = ContentHash.ofStrings(parts).substring(0, ID_LENGTH);
            parts.remove(parts.size() - 1);
        }
        return id;
    }

    @Override
    public void append(SaveRecord record) {
        List<SaveRecord> saves = new ArrayList<>(all());
        SaveRecord last = saves.isEmpty() ? null : saves.get(saves.size() - 1);

        String expectedBase = last == null ? null : last.id();
        if (!Objects.equals(expectedBase, record.baseId())) {
            throw new IllegalArgumentException("save " + record.id() + " must have base "
                    + expectedBase + " but has " + record.baseId());
        }
        if (last != null && record.createdAt().isBefore(last.createdAt())) {
            throw new IllegalArgumentException("save " + record.id() + " is older than the latest save " + last.id());
        }
        for (SaveRecord r : saves) {
            if (r.id().equals(record.id())) {
                throw new IllegalArgumentException("duplicate save id " + record.id());
            }
        }

        saves.add(record);
        write(new Document(saves));
    }

    @Override
    public SaveRecord find(String id) {
        for (SaveRecord r : all()) {
            if (r.id().equals(id)) return r;
        }
        throw NotFoundException.save(id);
    }

    @Override
    public Optional<SaveRecord> latest() {
        List<SaveRecord> saves = all();
        return saves.isEmpty() ? Optional.empty() : Optional.of(saves.get(saves.size() - 1));
    }

    @Override
    public List<SaveRecord> all() {
        if (!fs.exists(file)) {
            return List.of();
        }
        try {
            Document doc = mapper.readValue(fs.readFile(file), Document.class);
            return doc == null ? List.of() : doc.saves();
        } catch (IOException e) {
            throw new IntegrityException("unreadable save catalog " + file, e);
        }
    }

    private void write(Document doc) {
        try {
            fs.writeFile(file, mapper.writeValueAsBytes(doc));
        } catch (IOException e) {
            throw new IllegalStateException("failed to serialize save catalog", e);
        }
    }
}
