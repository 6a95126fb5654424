package com.dehazing.patchRecurrence.cache;

import com.dehazing.patchRecurrence.matchAndFilter.CandidatePair;
import com.dehazing.patchRecurrence.patch.ScalePatches;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Lưu patch và cặp ứng viên của một ảnh ra đĩa để lần chạy sau bỏ qua bước trích xuất và ghép cặp.
 * <p>
 * Entries are keyed by the input file name without extension:
 * {@code <key>.patches.json} and {@code <key>.pairs.json} inside the cache directory.
 * Doubles are written in their shortest round-trip form, so a restored run is bit-identical.
 */
public class PatchCache {
    private static final Logger LOG = LoggerFactory.getLogger(PatchCache.class);

    private static final String PATCHES_SUFFIX = ".patches.json";
    private static final String PAIRS_SUFFIX = ".pairs.json";

    private static final Type PATCHES_TYPE = new TypeToken<List<ScalePatches>>() {}.getType();
    private static final Type PAIRS_TYPE = new TypeToken<List<CandidatePair>>() {}.getType();

    private final Path directory;
    private final Gson gson;

    @AllArgsConstructor
    @Getter
    public static class Entry {
        private final List<ScalePatches> patches;
        private final List<CandidatePair> pairs;
    }

    public PatchCache(Path directory) {
        this.directory = directory;
        this.gson = new GsonBuilder().serializeSpecialFloatingPointValues().create();
    }

    public static String keyFor(Path input) {
        String name = input.getFileName().toString();
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public void save(String key, List<ScalePatches> patches, List<CandidatePair> pairs) throws IOException {
        Files.createDirectories(directory);
        try (Writer w = Files.newBufferedWriter(patchesFile(key), StandardCharsets.UTF_8)) {
            gson.toJson(patches, PATCHES_TYPE, w);
        }
        try (Writer w = Files.newBufferedWriter(pairsFile(key), StandardCharsets.UTF_8)) {
            gson.toJson(pairs, PAIRS_TYPE, w);
        }
        LOG.info("Saved {} scales and {} pairs to {}", patches.size(), pairs.size(), directory);
    }

    /**
     * @return the cached entry, or empty when either file is missing
     */
    public Optional<Entry> load(String key) throws IOException {
        Path patchesFile = patchesFile(key);
        Path pairsFile = pairsFile(key);
        if (!Files.exists(patchesFile) || !Files.exists(pairsFile)) {
            return Optional.empty();
        }
        try (Reader pr = Files.newBufferedReader(patchesFile, StandardCharsets.UTF_8);
             Reader cr = Files.newBufferedReader(pairsFile, StandardCharsets.UTF_8)) {
            List<ScalePatches> patches = gson.fromJson(pr, PATCHES_TYPE);
            List<CandidatePair> pairs = gson.fromJson(cr, PAIRS_TYPE);
            if (patches == null || pairs == null) {
                throw new IOException("Empty cache entry for " + key + " in " + directory);
            }
            return Optional.of(new Entry(patches, pairs));
        } catch (JsonParseException e) {
            throw new IOException("Corrupted cache entry for " + key + " in " + directory, e);
        }
    }

    private Path patchesFile(String key) {
        return directory.resolve(key + PATCHES_SUFFIX);
    }

    private Path pairsFile(String key) {
        return directory.resolve(key + PAIRS_SUFFIX);
    }
}
