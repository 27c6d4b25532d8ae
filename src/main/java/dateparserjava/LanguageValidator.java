package dateparserjava;

import java.util.*;
import java.util.logging.Logger;

/**
 * Checks the shape of a {@link LanguageInfo} before a language is trusted.
 *
 * <p>Every problem found is logged at {@code SEVERE}; validation continues after the
 * first problem so that a single run reports all of them.</p>
 */
public class LanguageValidator {
    private static final Logger LOGGER = Logger.getLogger(LanguageValidator.class.getName());

    /**
     * Validates a language configuration.
     *
     * @param languageId the language code, used in log messages
     * @param info       the configuration to validate
     * @return {@code true} if no problem was found
     */
    public boolean validate(String languageId, LanguageInfo info) {
        if (info == null) {
            LOGGER.severe(languageId + ": language info is missing");
            return false;
        }

        boolean valid = validateName(languageId, info);
        valid &= validateTokens(languageId, "skip", info.getSkip());
        valid &= validateTokens(languageId, "pertain", info.getPertain());
        valid &= validateNames(languageId, TokenSets.WEEKDAYS, info);
        valid &= validateNames(languageId, TokenSets.MONTHS, info);
        valid &= validateNames(languageId, TokenSets.HMS, info);
        valid &= validateRelativeType(languageId, info);
        valid &= validateSimplifications(languageId, info);
        valid &= validateSentenceSplitter(languageId, info);
        return valid;
    }

    protected boolean validateName(String languageId, LanguageInfo info) {
        String name = info.getName();
        if (name == null || name.trim().isEmpty()) {
            LOGGER.severe(languageId + ": 'name' must be a non-blank string");
            return false;
        }
        return true;
    }

    protected boolean validateTokens(String languageId, String field, List<String> tokens) {
        boolean valid = true;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (token == null || token.isEmpty()) {
                LOGGER.severe(languageId + ": '" + field + "' entry #" + i + " is empty");
                valid = false;
            }
        }
        return valid;
    }

    protected boolean validateNames(String languageId, List<String> canonicalWords, LanguageInfo info) {
        boolean valid = true;
        for (String canonical : canonicalWords) {
            if (!info.hasWords(canonical)) {
                LOGGER.severe(languageId + ": no translations for '" + canonical + "'");
                valid = false;
                continue;
            }
            List<String> forms = info.getWords(canonical);
            if (forms.isEmpty()) {
                LOGGER.severe(languageId + ": empty translation list for '" + canonical + "'");
                valid = false;
            }
            for (String form : forms) {
                if (form == null || form.trim().isEmpty()) {
                    LOGGER.severe(languageId + ": blank translation for '" + canonical + "'");
                    valid = false;
                }
            }
        }
        return valid;
    }

    protected boolean validateRelativeType(String languageId, LanguageInfo info) {
        boolean valid = true;
        for (Map.Entry<String, List<String>> e : info.getRelativeType().entrySet()) {
            if (e.getValue().isEmpty()) {
                LOGGER.severe(languageId + ": relative-type '" + e.getKey() + "' has no phrases");
                valid = false;
            }
            valid &= validateTokens(languageId, "relative-type." + e.getKey(), e.getValue());
        }
        return valid;
    }

    protected boolean validateSimplifications(String languageId, LanguageInfo info) {
        boolean valid = true;
        for (Simplification rule : info.getSimplifications()) {
            if (rule.getPattern().isEmpty()) {
                LOGGER.severe(languageId + ": simplification with an empty pattern");
                valid = false;
                continue;
            }
            try {
                PatternCache.compile(rule.getPattern());
                if (!info.isNoWordSpacing()) {
                    PatternCache.compile(rule.wrappedPattern());
                }
                Simplification.parseTemplate(rule.getReplacement());
            } catch (LanguageConfigurationException e) {
                LOGGER.severe(languageId + ": invalid simplification '" + rule + "': " + e.getMessage());
                valid = false;
            }
        }
        return valid;
    }

    protected boolean validateSentenceSplitter(String languageId, LanguageInfo info) {
        Integer group = info.getSentenceSplitterGroup();
        if (group != null && SentenceSplitter.tryParse(group) == null) {
            LOGGER.severe(languageId + ": 'sentence_splitter_group' must be between 1 and 6, got " + group);
            return false;
        }
        return true;
    }
}
