// file: core/src/main/java/io/bitstore/core/delta/EditScript.java
package io.bitstore.core.delta;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.ChangeDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.DeleteDelta;
import com.github.difflib.patch.InsertDelta;
import com.github.difflib.patch.Patch;
import com.github.difflib.patch.PatchFailedException;
import io.bitstore.core.PatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Line-oriented edit script between two texts.
 * <p>
 * Lines keep their trailing '\n' so that joining them reproduces the text
 * exactly, including a missing final newline. The script is stored as JSON:
 * <pre>
 *   {"hunks":[{"op":"CHANGE","sourcePosition":3,"source":["a\n"],
 *              "targetPosition":3,"target":["b\n"]}, ...]}
 * </pre>
 * Source lines are kept so that applying a script to the wrong base is
 * detected instead of silently producing garbage.
 */
public final class EditScript {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public enum Op { INSERT, DELETE, CHANGE }

    public record Hunk(
            @JsonProperty("op") Op op,
            @JsonProperty("sourcePosition") int sourcePosition,
            @JsonProperty("source") List<String> source,
            @JsonProperty("targetPosition") int targetPosition,
            @JsonProperty("target") List<String> target
    ) {
        public Hunk {
            Objects.requireNonNull(op, "op");
            source = source == null ? List.of() : List.copyOf(source);
            target = target == null ? List.of() : List.copyOf(target);
        }
    }

    record Document(@JsonProperty("hunks") List<Hunk> hunks) {}

    private final List<Hunk> hunks;

    private EditScript(List<Hunk> hunks) {
        this.hunks = List.copyOf(hunks);
    }

    /** Diff two texts line by line (Myers, via java-diff-utils). */
    public static EditScript between(String original, String revised) {
        Patch<String> patch = DiffUtils.diff(lines(original), lines(revised));
        List<Hunk> out = new ArrayList<>(patch.getDeltas().size());
        for (AbstractDelta<String> d : patch.getDeltas()) {
            Op op = switch (d.getType()) {
                case INSERT -> Op.INSERT;
                case DELETE -> Op.DELETE;
                case CHANGE -> Op.CHANGE;
                case EQUAL -> null;
            };
            if (op == null) continue;
            out.add(new Hunk(op,
                    d.getSource().getPosition(), d.getSource().getLines(),
                    d.getTarget().getPosition(), d.getTarget().getLines()));
        }
        return new EditScript(out);
    }

    /**
     * Parse the JSON form produced by {@link #toText()}.
     *
     * @throws PatchException if the text is not a valid script
     */
    public static EditScript parse(String text) {
        try {
            Document doc = MAPPER.readValue(text, Document.class);
            if (doc == null || doc.hunks() == null) {
                throw new PatchException("edit script has no hunks", null);
            }
            if (doc.hunks().contains(null)) {
                throw new PatchException("edit script has a null hunk", null);
            }
            return new EditScript(doc.hunks());
        } catch (JsonProcessingException e) {
            throw new PatchException("malformed edit script: " + e.getMessage(), e);
        }
    }

    public String toText() {
        try {
            return MAPPER.writeValueAsString(new Document(hunks));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("edit script serialization failed", e);
        }
    }

    public boolean isEmpty() {
        return hunks.isEmpty();
    }

    public List<Hunk> hunks() {
        return hunks;
    }

    /**
     * Apply to {@code base}, checking every hunk's source lines first.
     *
     * @throws PatchException if a hunk does not match the base
     */
    public String applyTo(String base) {
        Patch<String> patch = new Patch<>();
        for (Hunk h : hunks) {
            Chunk<String> src = new Chunk<>(h.sourcePosition(), h.source());
            Chunk<String> tgt = new Chunk<>(h.targetPosition(), h.target());
            patch.addDelta(switch (h.op()) {
                case INSERT -> new InsertDelta<>(src, tgt);
                case DELETE -> new DeleteDelta<>(src, tgt);
                case CHANGE -> new ChangeDelta<>(src, tgt);
            });
        }
        try {
            return String.join("", patch.applyTo(lines(base)));
        } catch (PatchFailedException | IndexOutOfBoundsException e) {
            throw new PatchException("edit script does not apply to base content: " + e.getMessage(), e);
        }
    }

    /** Split into lines, each keeping its terminating '\n' (the last one may have none). */
    static List<String> lines(String text) {
        List<String> out = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                out.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) out.add(text.substring(start));
        return out;
    }
}
