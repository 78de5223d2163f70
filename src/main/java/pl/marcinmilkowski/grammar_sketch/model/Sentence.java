package pl.marcinmilkowski.grammar_sketch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed sentence as delivered by the upstream dependency parser.
 * Immutable; lives for one detection pass.
 */
public record Sentence(
    String text,
    List<Token> tokens,
    List<Entity> entities
) {
    /**
     * A single parsed token.
     *
     * <p>{@code head} is kept exactly as the parser produced it: usually the
     * index of the governing token as a decimal string, occasionally the
     * governing token's text, or {@code null} for the root. Resolve it through
     * {@code DependencyUtils}, never directly.</p>
     */
    public record Token(
        int index,
        String text,
        String lemma,
        String pos,
        String tag,
        String dep,
        String head,
        Map<String, String> morph,
        int characterStart,
        int characterEnd,
        EntityMark entity
    ) {
        public Token {
            text = text == null ? "" : text;
            lemma = lemma == null || lemma.isEmpty() ? text : lemma;
            pos = pos == null ? "" : pos;
            tag = tag == null ? "" : tag;
            dep = dep == null ? "" : dep;
            head = head == null || head.isBlank() ? null : head.trim();
            morph = morph == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(morph));
            if (characterEnd <= characterStart) {
                throw new IllegalArgumentException("Token " + index + " ('" + text + "') has characterEnd "
                    + characterEnd + " <= characterStart " + characterStart);
            }
        }

        /**
         * Morphological feature value, or null when the parser did not supply it.
         */
        public String feature(String key) {
            return morph.get(key);
        }

        public boolean isEntity() {
            return entity != null;
        }

        public String lowerText() {
            return text.toLowerCase();
        }

        public String lowerLemma() {
            return lemma.toLowerCase();
        }
    }

    /**
     * Per-token named-entity annotation. Tokens of one multi-token entity
     * share the same {@code id}.
     */
    public record EntityMark(String type, int id, boolean start, boolean end, String text) {
    }

    /**
     * Sentence-level entity span, expressed in token indices.
     */
    public record Entity(String type, String text, int firstToken, int lastToken) {
    }

    public Sentence {
        text = text == null ? "" : text;
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        entities = entities == null ? List.of() : List.copyOf(entities);
        for (int i = 1; i < tokens.size(); i++) {
            if (tokens.get(i).index() <= tokens.get(i - 1).index()) {
                throw new IllegalArgumentException("Token indices must be strictly increasing; got "
                    + tokens.get(i - 1).index() + " before " + tokens.get(i).index());
            }
        }
    }

    public int tokenCount() {
        return tokens.size();
    }

    /**
     * Gets a token at the specified list position.
     * @param position 0-based position in {@link #tokens()}
     * @return the token, or null if position is out of bounds
     */
    public Token getToken(int position) {
        if (position < 0 || position >= tokens.size()) {
            return null;
        }
        return tokens.get(position);
    }

    /**
     * List position of the token carrying {@code index}, or -1.
     */
    public int positionOf(int index) {
        int lo = 0;
        int hi = tokens.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int value = tokens.get(mid).index();
            if (value == index) {
                return mid;
            } else if (value < index) {
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return -1;
    }

    public Optional<Token> tokenAt(int index) {
        int position = positionOf(index);
        return position < 0 ? Optional.empty() : Optional.of(tokens.get(position));
    }

    /**
     * Builder for creating Sentence instances.
     */
    public static class Builder {
        private String text;
        private final List<Token> tokens = new ArrayList<>();
        private final List<Entity> entities = new ArrayList<>();

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder addToken(Token token) {
            tokens.add(token);
            return this;
        }

        public Builder addEntity(Entity entity) {
            entities.add(entity);
            return this;
        }

        public Sentence build() {
            return new Sentence(text, tokens, entities);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
