package com.lexkb.search.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LegalTextAnalyzerTest {

    private LegalTextAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new LegalTextAnalyzer(new LegalDictionaryLoader().load(new AnalyzerProperties()));
    }

    @Test
    void latinTokensAreFoldedStemmedAndStripped() {
        List<Token> tokens = analyzer.analyze("The Contracts were SIGNED", "en", IndexField.TITLE, AnalysisMode.INDEX);

        assertThat(tokens).extracting(Token::term).containsExactly("contract", "sign");
        assertThat(tokens).extracting(Token::surface).containsExactly("contracts", "signed");
        assertThat(tokens).extracting(Token::position).containsExactly(0, 1);
        assertThat(tokens).allMatch(token -> token.field() == IndexField.TITLE);
    }

    @Test
    void legalKeywordSurvivesStopwordList() {
        List<String> terms = terms("Tenant shall pay the rent", "en");

        assertThat(terms).contains("shall").doesNotContain("the");
    }

    @Test
    void compoundIsStackedOverItsPartsWhenIndexing() {
        List<Token> tokens = analyzer.analyze("劳动合同纠纷", "zh", IndexField.CONTENT, AnalysisMode.INDEX);

        assertThat(tokens).extracting(Token::term).containsExactly("劳动", "合同", "劳动合同", "纠纷");
        assertThat(tokens).extracting(Token::position).containsExactly(0, 1, 0, 2);
        assertThat(tokens).extracting(Token::stacked).containsExactly(false, false, true, false);
    }

    @Test
    void queryModeKeepsOnlyTheFinestParts() {
        assertThat(analyzer.normalizeTerms("劳动合同纠纷", "zh")).containsExactly("劳动", "合同", "纠纷");
    }

    @Test
    void cjkStopwordsAreDroppedAroundDictionaryWords() {
        assertThat(terms("我的律师", "zh")).containsExactly("律师");
    }

    @Test
    void unknownCjkRunsFallBackToBigrams() {
        assertThat(terms("甲乙丙", "zh")).containsExactly("甲乙", "乙丙");
    }

    @Test
    void mixedScriptTextIsSplitAtScriptBoundaries() {
        assertThat(terms("GDPR合规指南", null)).containsExactly("gdpr", "合规", "指南");
    }

    @Test
    void hyphenatedWordsStayWhole() {
        assertThat(analyzer.analyzeQuery("non-compete clause", "en"))
            .extracting(Token::surface)
            .containsExactly("non-compete", "clause");
    }

    @Test
    void analysisIsDeterministic() {
        String text = "合同法第十二条 Contract law governs the agreement";

        assertThat(analyzer.analyze(text, null, IndexField.CONTENT, AnalysisMode.INDEX))
            .isEqualTo(analyzer.analyze(text, null, IndexField.CONTENT, AnalysisMode.INDEX));
    }

    @Test
    void blankTextProducesNoTokens() {
        assertThat(analyzer.analyze("", "en", IndexField.TITLE, AnalysisMode.INDEX)).isEmpty();
        assertThat(analyzer.analyze(null, "en", IndexField.TITLE, AnalysisMode.INDEX)).isEmpty();
        assertThat(analyzer.analyzeQuery("the and of", "en")).isEmpty();
    }

    private List<String> terms(String text, String language) {
        return analyzer.analyze(text, language, IndexField.CONTENT, AnalysisMode.INDEX).stream().map(Token::term).toList();
    }
}
