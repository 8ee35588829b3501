package org.textcurator.service.language;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Holds one {@link LanguageProfile} per supported language code.
 *
 * <p>The set of profiles is fixed at construction and never modified, so
 * lookups need no synchronisation. Unknown codes resolve to the English
 * profile.</p>
 */
@Slf4j
public class LanguageProfileRegistry {

    /** Minimum share of Vietnamese-specific letters among Latin letters to classify text as Vietnamese. */
    private static final double VIETNAMESE_LETTER_RATIO = 0.05;

    private final Map<String, LanguageProfile> profiles;
    private final LanguageProfile defaultProfile;

    public LanguageProfileRegistry() {
        this(List.of(
                new EnglishLanguageProfile(),
                new KoreanLanguageProfile(),
                new ChineseLanguageProfile(),
                new JapaneseLanguageProfile(),
                new SpanishLanguageProfile(),
                new FrenchLanguageProfile(),
                new GermanLanguageProfile(),
                new PortugueseLanguageProfile(),
                new RussianLanguageProfile(),
                new ArabicLanguageProfile(),
                new HindiLanguageProfile(),
                new VietnameseLanguageProfile(),
                new ThaiLanguageProfile()));
    }

    /**
     * Creates a registry over the given profiles. An English profile is added when missing.
     */
    public LanguageProfileRegistry(Collection<? extends LanguageProfile> languageProfiles) {
        Map<String, LanguageProfile> byCode = new LinkedHashMap<>();
        for (LanguageProfile profile : languageProfiles) {
            byCode.putIfAbsent(profile.getLanguageCode().toLowerCase(Locale.ROOT), profile);
        }
        byCode.putIfAbsent(EnglishLanguageProfile.CODE, new EnglishLanguageProfile());

        this.profiles = Collections.unmodifiableMap(byCode);
        this.defaultProfile = byCode.get(EnglishLanguageProfile.CODE);
        log.debug("Language profile registry initialised with {}", byCode.keySet());
    }

    /**
     * Resolves a profile by code, falling back to English.
     */
    public LanguageProfile getProfile(String languageCode) {
        if (languageCode == null || languageCode.isBlank()) {
            return defaultProfile;
        }
        return profiles.getOrDefault(languageCode.strip().toLowerCase(Locale.ROOT), defaultProfile);
    }

    public LanguageProfile getDefaultProfile() {
        return defaultProfile;
    }

    public boolean isSupported(String languageCode) {
        return languageCode != null && profiles.containsKey(languageCode.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Registered language codes in registration order.
     */
    public List<String> supportedLanguages() {
        return List.copyOf(profiles.keySet());
    }

    public Collection<LanguageProfile> getProfiles() {
        return profiles.values();
    }

    /**
     * Detects the language of {@code text} and returns its profile.
     */
    public LanguageProfile detectProfile(String text) {
        return getProfile(detectLanguage(text));
    }

    /**
     * Classifies text by its dominant script.
     *
     * <p>Whitespace, digits and punctuation are ignored. CJK ideographs count as
     * Japanese when any kana is present, Chinese otherwise. Latin letters count as
     * Vietnamese when Vietnamese-specific letters make up at least 5% of them.
     * Ties go to the family listed first in {@link ScriptFamily}.</p>
     *
     * @return a language code; {@code "en"} when nothing could be classified
     */
    public String detectLanguage(String text) {
        if (text == null || text.isBlank()) {
            return EnglishLanguageProfile.CODE;
        }

        int[] counts = new int[ScriptFamily.values().length];
        int kana = 0;
        int han = 0;
        int latin = 0;
        int vietnamese = 0;

        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (!Character.isLetter(cp)) {
                continue;
            }

            Character.UnicodeScript script = Character.UnicodeScript.of(cp);
            switch (script) {
                case HANGUL -> counts[ScriptFamily.HANGUL.ordinal()]++;
                case HIRAGANA, KATAKANA -> kana++;
                case HAN -> han++;
                case CYRILLIC -> counts[ScriptFamily.CYRILLIC.ordinal()]++;
                case ARABIC -> counts[ScriptFamily.ARABIC.ordinal()]++;
                case DEVANAGARI -> counts[ScriptFamily.DEVANAGARI.ordinal()]++;
                case THAI -> counts[ScriptFamily.THAI.ordinal()]++;
                case LATIN -> {
                    latin++;
                    if (isVietnameseLetter(cp)) {
                        vietnamese++;
                    }
                }
                default -> {
                }
            }
        }

        if (kana > 0) {
            counts[ScriptFamily.KANA.ordinal()] = kana + han;
        } else {
            counts[ScriptFamily.HAN.ordinal()] = han;
        }
        if (latin > 0 && vietnamese >= latin * VIETNAMESE_LETTER_RATIO) {
            counts[ScriptFamily.VIETNAMESE_LATIN.ordinal()] = latin;
        } else {
            counts[ScriptFamily.LATIN.ordinal()] = latin;
        }

        ScriptFamily dominant = null;
        int best = 0;
        for (ScriptFamily family : ScriptFamily.values()) {
            if (counts[family.ordinal()] > best) {
                best = counts[family.ordinal()];
                dominant = family;
            }
        }

        String code = dominant == null ? EnglishLanguageProfile.CODE : dominant.languageCode;
        log.debug("Detected language '{}' (dominant script: {})", code, dominant);
        return code;
    }

    static boolean isVietnameseLetter(int cp) {
        if (cp >= 0x1EA0 && cp <= 0x1EF9) {
            return true;
        }
        return switch (Character.toLowerCase(cp)) {
            case 'ă', 'â', 'đ', 'ê', 'ô', 'ơ', 'ư' -> true;
            default -> false;
        };
    }

    /**
     * Script families in tie-breaking priority order.
     */
    enum ScriptFamily {
        HANGUL(KoreanLanguageProfile.CODE),
        KANA(JapaneseLanguageProfile.CODE),
        HAN(ChineseLanguageProfile.CODE),
        CYRILLIC(RussianLanguageProfile.CODE),
        ARABIC(ArabicLanguageProfile.CODE),
        DEVANAGARI(HindiLanguageProfile.CODE),
        THAI(ThaiLanguageProfile.CODE),
        VIETNAMESE_LATIN(VietnameseLanguageProfile.CODE),
        LATIN(EnglishLanguageProfile.CODE);

        private final String languageCode;

        ScriptFamily(String languageCode) {
            this.languageCode = languageCode;
        }
    }
}
