package io.kneo.playqueue.queue;

import io.kneo.playqueue.model.Song;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Tag matcher used by queue find/search. All clauses must match.
 */
public class SongFilter implements Predicate<Song> {
    public static final String URI_TAG = "file";
    public static final String ANY_TAG = "any";

    private final List<Clause> clauses;
    private final boolean foldCase;

    private SongFilter(List<Clause> clauses, boolean foldCase) {
        this.clauses = Collections.unmodifiableList(clauses);
        this.foldCase = foldCase;
    }

    /**
     * Exact, case sensitive comparison.
     */
    public static SongFilter exact(Map<String, String> clauses) {
        return new SongFilter(toClauses(clauses, false), false);
    }

    /**
     * Case-insensitive substring comparison.
     */
    public static SongFilter search(Map<String, String> clauses) {
        return new SongFilter(toClauses(clauses, true), true);
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    @Override
    public boolean test(Song song) {
        for (Clause clause : clauses) {
            if (!matches(clause, song)) {
                return false;
            }
        }
        return true;
    }

    private boolean matches(Clause clause, Song song) {
        if (URI_TAG.equals(clause.tag())) {
            return matchValue(clause.value(), song.getUri());
        }
        if (ANY_TAG.equals(clause.tag())) {
            if (matchValue(clause.value(), song.getUri())) {
                return true;
            }
            for (String value : song.getTags().values()) {
                if (matchValue(clause.value(), value)) {
                    return true;
                }
            }
            return false;
        }
        return matchValue(clause.value(), song.getTag(clause.tag()));
    }

    private boolean matchValue(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        if (foldCase) {
            return actual.toLowerCase(Locale.ROOT).contains(expected);
        }
        return actual.equals(expected);
    }

    private static List<Clause> toClauses(Map<String, String> source, boolean foldCase) {
        List<Clause> result = new ArrayList<>(source.size());
        source.forEach((tag, value) -> {
            if (tag == null || value == null) {
                throw new IllegalArgumentException("Filter tag and value must not be null");
            }
            String tagName = tag.toLowerCase(Locale.ROOT);
            result.add(new Clause(tagName, foldCase ? value.toLowerCase(Locale.ROOT) : value));
        });
        return result;
    }

    private record Clause(String tag, String value) {
    }
}
