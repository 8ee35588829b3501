package org.textcurator.api.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.textcurator.api.model.LanguageDetectionRequest;
import org.textcurator.api.model.LanguageInfo;
import org.textcurator.service.language.LanguageProfileRegistry;

import java.util.List;

/**
 * Lists supported languages and detects the language of a text.
 */
@RestController
@RequestMapping("/api/languages")
@RequiredArgsConstructor
public class LanguageController {

    private final LanguageProfileRegistry registry;

    @GetMapping
    public List<LanguageInfo> languages() {
        return registry.getProfiles().stream()
                .map(LanguageInfo::of)
                .toList();
    }

    @PostMapping("/detect")
    public LanguageInfo detect(@RequestBody LanguageDetectionRequest request) {
        return LanguageInfo.of(registry.detectProfile(request.getText()));
    }
}
