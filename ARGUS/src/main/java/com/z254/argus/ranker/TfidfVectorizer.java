package com.z254.argus.ranker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Term-frequency / inverse-document-frequency features over alert text.
 * <p>
 * The vocabulary is the {@code maxFeatures} most frequent tokens (two or more
 * word characters) of the training corpus, in alphabetical order. IDF is
 * smoothed as {@code ln((1 + n) / (1 + df)) + 1} and rows are L2-normalized.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TfidfVectorizer {

    private static final Pattern TOKEN = Pattern.compile("(?U)\\b\\w\\w+\\b");

    private List<String> vocabulary = new ArrayList<>();
    private double[] idf = new double[0];

    @JsonIgnore
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private transient volatile Map<String, Integer> positions;

    public static TfidfVectorizer fit(List<String> documents, int maxFeatures) {
        Map<String, Long> termCounts = new HashMap<>();
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (String document : documents) {
            Set<String> seen = new HashSet<>();
            for (String token : tokenize(document)) {
                termCounts.merge(token, 1L, Long::sum);
                if (seen.add(token)) {
                    documentFrequency.merge(token, 1, Integer::sum);
                }
            }
        }

        List<String> selected = new ArrayList<>(termCounts.keySet());
        selected.sort(Comparator.<String, Long>comparing(termCounts::get).reversed()
                .thenComparing(Comparator.naturalOrder()));
        if (selected.size() > maxFeatures) {
            selected = new ArrayList<>(selected.subList(0, maxFeatures));
        }
        selected.sort(Comparator.naturalOrder());

        int n = documents.size();
        double[] weights = new double[selected.size()];
        for (int i = 0; i < selected.size(); i++) {
            int df = documentFrequency.get(selected.get(i));
            weights[i] = Math.log((1.0 + n) / (1.0 + df)) + 1.0;
        }
        return new TfidfVectorizer(selected, weights, null);
    }

    public float[] transform(String document) {
        Map<String, Integer> index = index();
        float[] row = new float[vocabulary.size()];
        for (String token : tokenize(document)) {
            Integer position = index.get(token);
            if (position != null) {
                row[position] += 1f;
            }
        }
        double norm = 0;
        for (int i = 0; i < row.length; i++) {
            row[i] = (float) (row[i] * idf[i]);
            norm += row[i] * row[i];
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < row.length; i++) {
                row[i] *= scale;
            }
        }
        return row;
    }

    @JsonIgnore
    public int size() {
        return vocabulary.size();
    }

    static List<String> tokenize(String document) {
        List<String> tokens = new ArrayList<>();
        if (document == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(document.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private Map<String, Integer> index() {
        Map<String, Integer> current = positions;
        if (current == null) {
            current = new HashMap<>();
            for (int i = 0; i < vocabulary.size(); i++) {
                current.put(vocabulary.get(i), i);
            }
            positions = current;
        }
        return current;
    }
}
