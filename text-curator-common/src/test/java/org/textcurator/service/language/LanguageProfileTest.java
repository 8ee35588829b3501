package org.textcurator.service.language;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageProfileTest {

    @Nested
    @DisplayName("English")
    class English {

        private final LanguageProfile profile = new EnglishLanguageProfile();

        @Test
        @DisplayName("Sentence ends skip abbreviations")
        void sentenceBoundaries() {
            String text = "Dr. Smith went home. He slept.";

            assertThat(profile.findSentenceBoundaries(text)).containsExactly(20, 30);
        }

        @Test
        @DisplayName("Two-word abbreviations such as 'et al.' are not sentence ends")
        void twoWordAbbreviation() {
            String text = "See Smith et al. The results hold.";

            assertThat(profile.findSentenceBoundaries(text)).containsExactly(text.length());
        }

        @Test
        @DisplayName("The text end is always the last boundary")
        void trailingBoundary() {
            String text = "No terminal punctuation here";

            assertThat(profile.findSentenceBoundaries(text)).containsExactly(text.length());
            assertThat(profile.findSentenceBoundaries("")).isEmpty();
            assertThat(profile.findSentenceBoundaries(null)).isEmpty();
        }

        @Test
        @DisplayName("A closing quote stays with its sentence")
        void closingQuote() {
            String text = "He said \"Stop.\" Then he left.";

            assertThat(profile.findSentenceBoundaries(text)).containsExactly(15, text.length());
        }

        @Test
        @DisplayName("Paragraphs start after blank lines")
        void paragraphBoundaries() {
            assertThat(profile.findParagraphBoundaries("A.\n\nB.\n\nC.")).containsExactly(4, 8, 10);
        }

        @Test
        @DisplayName("Markdown and chapter/section idioms are headers")
        void sectionHeaders() {
            String text = "# Guide\nIntro.\nChapter 1\nText.\nSection 2\nMore.\n## Details\nEnd.";

            List<SectionHeader> headers = profile.findSectionHeaders(text);

            assertThat(headers).extracting(SectionHeader::text)
                    .containsExactly("Guide", "Chapter 1", "Section 2", "Details");
            assertThat(headers).extracting(SectionHeader::level).containsExactly(1, 1, 2, 2);
            assertThat(headers.get(0).start()).isZero();
        }

        @Test
        @DisplayName("Token estimate is non-whitespace characters over 4, rounded up")
        void tokenEstimate() {
            assertThat(profile.estimateTokenCount("abcd efgh")).isEqualTo(2);
            assertThat(profile.estimateTokenCount("abcde")).isEqualTo(2);
            assertThat(profile.estimateTokenCount("   ")).isZero();
            assertThat(profile.estimateTokenCount(null)).isZero();
        }

        @Test
        @DisplayName("Token weight is additive over concatenation")
        void weightIsAdditive() {
            String text = "Hello brave new world";

            assertThat(profile.tokenWeight(text, 0, 5) + profile.tokenWeight(text, 5, text.length()))
                    .isEqualTo(profile.tokenWeight(text));
        }
    }

    @Nested
    @DisplayName("Korean")
    class Korean {

        private final LanguageProfile profile = new KoreanLanguageProfile();

        @Test
        @DisplayName("Polite and formal endings close sentences")
        void endings() {
            String text = "안녕하세요. 반갑습니다.";

            assertThat(profile.findSentenceBoundaries(text)).containsExactly(6, text.length());
        }

        @Test
        @DisplayName("Sentence ends inside quotes are ignored")
        void quotedSpeech() {
            String text = "그가 \"안녕하세요. 반갑습니다.\" 라고 말했다.";

            assertThat(profile.findSentenceBoundaries(text)).containsExactly(text.length());
        }

        @Test
        @DisplayName("Hangul weighs 1.5 characters per token, other characters 4")
        void mixedScriptEstimate() {
            assertThat(profile.estimateTokenCount("안녕하세요")).isEqualTo(4);
            assertThat(profile.estimateTokenCount("안녕 abc")).isEqualTo(3);
        }

        @Test
        @DisplayName("제n장 / 제n절 / 제n조 map to levels 1 to 3")
        void headers() {
            String text = "제1장 총칙\n내용입니다.\n제2절 정의\n설명입니다.\n제3조 목적\n목적입니다.";

            assertThat(profile.findSectionHeaders(text)).extracting(SectionHeader::level)
                    .containsExactly(1, 2, 3);
        }
    }

    @Nested
    @DisplayName("CJK and others")
    class Others {

        @Test
        @DisplayName("Chinese full-width stops end sentences without spaces")
        void chineseSentences() {
            LanguageProfile profile = new ChineseLanguageProfile();
            String text = "今天天气很好。我们去公园吧！";

            assertThat(profile.findSentenceBoundaries(text)).containsExactly(7, text.length());
        }

        @Test
        @DisplayName("Chinese ideographic-space indentation starts a paragraph")
        void chineseIndentedParagraph() {
            LanguageProfile profile = new ChineseLanguageProfile();
            String text = "第一段内容。\n　　第二段内容。";

            assertThat(profile.findParagraphBoundaries(text)).containsExactly(7, text.length());
        }

        @Test
        @DisplayName("Chinese chapter and enumerated headers")
        void chineseHeaders() {
            LanguageProfile profile = new ChineseLanguageProfile();
            String text = "第一章 总则\n内容。\n一、目的\n内容。\n（一）范围\n内容。";

            assertThat(profile.findSectionHeaders(text)).extracting(SectionHeader::level)
                    .containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("Hindi danda ends a sentence")
        void hindiDanda() {
            LanguageProfile profile = new HindiLanguageProfile();
            String text = "यह पहला वाक्य है। यह दूसरा है।";

            assertThat(profile.findSentenceBoundaries(text)).hasSize(2);
        }

        @Test
        @DisplayName("Chars-per-token ratios follow the script")
        void ratios() {
            assertThat(new JapaneseLanguageProfile().getCharsPerToken()).isEqualTo(1.5);
            assertThat(new ThaiLanguageProfile().getCharsPerToken()).isEqualTo(2.0);
            assertThat(new ArabicLanguageProfile().getCharsPerToken()).isEqualTo(3.0);
            assertThat(new SpanishLanguageProfile().getCharsPerToken()).isEqualTo(4.5);
            assertThat(new GermanLanguageProfile().getCharsPerToken()).isEqualTo(5.0);
            assertThat(new VietnameseLanguageProfile().getCharsPerToken()).isEqualTo(4.0);
        }

        @Test
        @DisplayName("German chapter idiom is a level 1 header")
        void germanHeader() {
            LanguageProfile profile = new GermanLanguageProfile();

            assertThat(profile.findSectionHeaders("Kapitel 3\nText.\nAbschnitt 2\nMehr."))
                    .extracting(SectionHeader::level)
                    .containsExactly(1, 2);
        }
    }
}
