package dateparserjava;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Immutable per-language configuration record.
 *
 * <p>Holds the canonical name, skip and pertain words, surface forms for every
 * canonical word of {@link TokenSets#KNOWN_WORD_TOKENS}, relative phrases, ordered
 * simplification rules, the sentence splitter group and the no-word-spacing flag.</p>
 *
 * <p>Instances are created with {@link #builder(String)} or parsed from a JSON
 * document with {@link #fromJson(InputStream)}:</p>
 * <pre>{@code
 * {
 *   "name": "en",
 *   "skip": ["and", "at"],
 *   "monday": ["monday", "mon"],
 *   "relative-type": {"1 day ago": ["yesterday"]},
 *   "simplifications": [{"an": 1}, {"(\\d+)h(\\d+)": "\\1:\\2"}],
 *   "sentence_splitter_group": 1
 * }
 * }</pre>
 */
public final class LanguageInfo {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final List<String> skip;
    private final List<String> pertain;
    private final Map<String, List<String>> words;
    private final Map<String, List<String>> relativeType;
    private final List<Simplification> simplifications;
    private final Integer sentenceSplitterGroup;
    private final boolean noWordSpacing;

    private LanguageInfo(Builder b) {
        this.name = b.name;
        this.skip = Collections.unmodifiableList(new ArrayList<>(b.skip));
        this.pertain = Collections.unmodifiableList(new ArrayList<>(b.pertain));
        this.words = freeze(b.words);
        this.relativeType = freeze(b.relativeType);
        this.simplifications = Collections.unmodifiableList(new ArrayList<>(b.simplifications));
        this.sentenceSplitterGroup = b.sentenceSplitterGroup;
        this.noWordSpacing = b.noWordSpacing;
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : source.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }
        return Collections.unmodifiableMap(copy);
    }

    public String getName() {
        return name;
    }

    public List<String> getSkip() {
        return skip;
    }

    public List<String> getPertain() {
        return pertain;
    }

    /**
     * Returns the surface forms configured for a canonical word.
     *
     * @param canonical a canonical word such as {@code "monday"} or {@code "hour"}
     * @return the surface forms, or an empty list if none are configured
     */
    public List<String> getWords(String canonical) {
        List<String> list = words.get(canonical);
        return list == null ? Collections.emptyList() : list;
    }

    public boolean hasWords(String canonical) {
        return words.containsKey(canonical);
    }

    /**
     * All configured canonical word lists, in declaration order.
     *
     * @return canonical word → surface forms
     */
    public Map<String, List<String>> getWords() {
        return words;
    }

    /**
     * Relative phrases keyed by their canonical translation (e.g. {@code "1 day ago"}).
     *
     * @return canonical phrase → surface phrases
     */
    public Map<String, List<String>> getRelativeType() {
        return relativeType;
    }

    public List<Simplification> getSimplifications() {
        return simplifications;
    }

    /**
     * The configured sentence splitter group, or {@code null} when the default applies.
     *
     * @return the group number or {@code null}
     */
    public Integer getSentenceSplitterGroup() {
        return sentenceSplitterGroup;
    }

    public boolean isNoWordSpacing() {
        return noWordSpacing;
    }

    @Override
    public String toString() {
        return "<LanguageInfo " + name + " with " + words.size() + " word lists, "
                + simplifications.size() + " simplifications>";
    }

    // ---------------------------------------------------------------------
    // JSON
    // ---------------------------------------------------------------------

    /**
     * Parses a language document from a JSON stream.
     *
     * @param in the stream to read; not closed by this method
     * @return the parsed configuration
     * @throws IOException                    if the stream is not readable JSON
     * @throws LanguageConfigurationException if the document has the wrong shape
     */
    public static LanguageInfo fromJson(InputStream in) throws IOException {
        return fromTree(MAPPER.readTree(in));
    }

    /**
     * Parses a language document from a JSON file.
     *
     * @param path the file to read
     * @return the parsed configuration
     * @throws IOException                    if the file cannot be read or parsed
     * @throws LanguageConfigurationException if the document has the wrong shape
     */
    public static LanguageInfo fromJson(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        }
    }

    /**
     * Parses a language document from JSON text.
     *
     * @param json the JSON text
     * @return the parsed configuration
     * @throws IOException                    if the text is not valid JSON
     * @throws LanguageConfigurationException if the document has the wrong shape
     */
    public static LanguageInfo fromJson(String json) throws IOException {
        return fromTree(MAPPER.readTree(json));
    }

    static LanguageInfo fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new LanguageConfigurationException("Language document must be a JSON object");
        }
        JsonNode nameNode = root.get("name");
        if (nameNode == null || !nameNode.isTextual()) {
            throw new LanguageConfigurationException("Language document has no 'name'");
        }

        Builder b = builder(nameNode.asText());
        b.skip(stringList(root, "skip"));
        b.pertain(stringList(root, "pertain"));

        for (String word : TokenSets.KNOWN_WORD_TOKENS) {
            if (root.has(word)) {
                b.words(word, stringList(root, word));
            }
        }

        JsonNode relative = root.get("relative-type");
        if (relative != null && !relative.isNull()) {
            if (!relative.isObject()) {
                throw new LanguageConfigurationException("'relative-type' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = relative.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                b.relativeType(e.getKey(), toStringList(e.getValue(), "relative-type." + e.getKey()));
            }
        }

        JsonNode simplifications = root.get("simplifications");
        if (simplifications != null && !simplifications.isNull()) {
            if (!simplifications.isArray()) {
                throw new LanguageConfigurationException("'simplifications' must be an array");
            }
            for (JsonNode rule : simplifications) {
                b.simplification(parseSimplification(rule));
            }
        }

        JsonNode group = root.get("sentence_splitter_group");
        if (group != null && !group.isNull()) {
            if (!group.canConvertToInt() || !group.isIntegralNumber()) {
                throw new LanguageConfigurationException("'sentence_splitter_group' must be an integer");
            }
            b.sentenceSplitterGroup(group.asInt());
        }

        JsonNode noSpacing = root.get("no_word_spacing");
        if (noSpacing != null && !noSpacing.isNull()) {
            if (noSpacing.isBoolean()) {
                b.noWordSpacing(noSpacing.booleanValue());
            } else if (noSpacing.isTextual()) {
                b.noWordSpacing(Boolean.parseBoolean(noSpacing.asText().trim()));
            } else {
                throw new LanguageConfigurationException("'no_word_spacing' must be a boolean");
            }
        }

        return b.build();
    }

    private static Simplification parseSimplification(JsonNode rule) {
        if (!rule.isObject() || rule.size() != 1) {
            throw new LanguageConfigurationException("Simplification must be a single-entry object: " + rule);
        }
        Map.Entry<String, JsonNode> e = rule.fields().next();
        JsonNode value = e.getValue();
        if (value.isIntegralNumber()) {
            return new Simplification(e.getKey(), value.asInt());
        }
        if (value.isTextual()) {
            return new Simplification(e.getKey(), value.asText());
        }
        throw new LanguageConfigurationException("Simplification replacement must be a string or an integer: " + rule);
    }

    private static List<String> stringList(JsonNode parent, String field) {
        return toStringList(parent.get(field), field);
    }

    private static List<String> toStringList(JsonNode node, String field) {
        if (node == null || node.isNull()) return Collections.emptyList();
        if (!node.isArray()) {
            throw new LanguageConfigurationException("'" + field + "' must be an array of strings");
        }
        List<String> out = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new LanguageConfigurationException("'" + field + "' contains a non-string entry: " + item);
            }
            out.add(item.asText());
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    /**
     * Starts a builder for a language with the given canonical name.
     *
     * @param name the canonical language identifier
     * @return a new builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Mutable builder for {@link LanguageInfo}.
     */
    public static final class Builder {
        private final String name;
        private final List<String> skip = new ArrayList<>();
        private final List<String> pertain = new ArrayList<>();
        private final Map<String, List<String>> words = new LinkedHashMap<>();
        private final Map<String, List<String>> relativeType = new LinkedHashMap<>();
        private final List<Simplification> simplifications = new ArrayList<>();
        private Integer sentenceSplitterGroup;
        private boolean noWordSpacing;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder skip(String... tokens) {
            return skip(Arrays.asList(tokens));
        }

        public Builder skip(Collection<String> tokens) {
            skip.addAll(tokens);
            return this;
        }

        public Builder pertain(String... tokens) {
            return pertain(Arrays.asList(tokens));
        }

        public Builder pertain(Collection<String> tokens) {
            pertain.addAll(tokens);
            return this;
        }

        /**
         * Sets the surface forms of a canonical word.
         *
         * @param canonical one of {@link TokenSets#KNOWN_WORD_TOKENS}
         * @param forms     its surface forms
         * @return this builder
         * @throws IllegalArgumentException if {@code canonical} is not a known word
         */
        public Builder words(String canonical, String... forms) {
            return words(canonical, Arrays.asList(forms));
        }

        public Builder words(String canonical, Collection<String> forms) {
            if (!TokenSets.KNOWN_WORD_TOKENS.contains(canonical)) {
                throw new IllegalArgumentException("Unknown canonical word: " + canonical);
            }
            words.put(canonical, new ArrayList<>(forms));
            return this;
        }

        public Builder relativeType(String canonical, String... phrases) {
            return relativeType(canonical, Arrays.asList(phrases));
        }

        public Builder relativeType(String canonical, Collection<String> phrases) {
            relativeType.put(canonical, new ArrayList<>(phrases));
            return this;
        }

        public Builder simplification(String pattern, String replacement) {
            return simplification(new Simplification(pattern, replacement));
        }

        public Builder simplification(String pattern, int replacement) {
            return simplification(new Simplification(pattern, replacement));
        }

        public Builder simplification(Simplification rule) {
            simplifications.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder sentenceSplitterGroup(int group) {
            this.sentenceSplitterGroup = group;
            return this;
        }

        public Builder noWordSpacing(boolean noWordSpacing) {
            this.noWordSpacing = noWordSpacing;
            return this;
        }

        public LanguageInfo build() {
            return new LanguageInfo(this);
        }
    }
}
