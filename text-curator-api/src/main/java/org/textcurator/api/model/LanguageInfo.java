package org.textcurator.api.model;

import org.textcurator.service.language.LanguageProfile;

/**
 * A supported language as exposed over HTTP.
 */
public record LanguageInfo(String languageCode, String languageName, double charsPerToken) {

    public static LanguageInfo of(LanguageProfile profile) {
        return new LanguageInfo(profile.getLanguageCode(), profile.getLanguageName(), profile.getCharsPerToken());
    }
}
