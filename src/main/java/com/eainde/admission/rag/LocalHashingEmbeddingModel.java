package com.eainde.admission.rag;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Offline embedding model using the signed hashing trick over word tokens and their
 * six-character stems. Deterministic and dependency free, so the rule index works without
 * a remote embedding endpoint; any other {@link EmbeddingModel} bean can replace it.
 */
public class LocalHashingEmbeddingModel implements EmbeddingModel {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final int STEM_LENGTH = 6;

    private final int dimension;

    public LocalHashingEmbeddingModel(int dimension) {
        if (dimension < 16) {
            throw new IllegalArgumentException("dimension must be >= 16");
        }
        this.dimension = dimension;
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
        List<Embedding> embeddings = new ArrayList<>(textSegments.size());
        for (TextSegment segment : textSegments) {
            embeddings.add(Embedding.from(vectorize(segment.text())));
        }
        return Response.from(embeddings);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    float[] vectorize(String text) {
        float[] vector = new float[dimension];
        for (String token : tokenize(text)) {
            accumulate(vector, token, 1.0f);
            if (token.length() > STEM_LENGTH) {
                accumulate(vector, "~" + token.substring(0, STEM_LENGTH), 0.5f);
            }
        }
        normalize(vector);
        return vector;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String folded = DIACRITICS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        for (String token : NON_WORD.split(folded.toLowerCase(Locale.ROOT))) {
            if (token.length() > 1) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private void accumulate(float[] vector, String feature, float weight) {
        int hash = mix(feature.hashCode());
        int bucket = Math.floorMod(hash, dimension);
        vector[bucket] += (hash & 0x40000000) == 0 ? weight : -weight;
    }

    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    private static void normalize(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += v * v;
        }
        if (sum == 0.0) {
            return;
        }
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
