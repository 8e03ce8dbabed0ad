package com.purchasingpower.docqa.service;

import com.purchasingpower.docqa.configuration.AppProperties;
import com.purchasingpower.docqa.knowledge.ScoredChunk;
import com.purchasingpower.docqa.model.conversation.Conversation;
import com.purchasingpower.docqa.model.document.Document;
import com.purchasingpower.docqa.model.document.DocumentChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextBuilderTest {

    private AppProperties appProperties;
    private ContextBuilder contextBuilder;
    private Document guide;
    private Document faq;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        contextBuilder = new ContextBuilder(appProperties);
        Conversation conversation = Conversation.builder().conversationId("c1").userId("u").build();
        guide = Document.builder().id(1L).filename("guide.md").conversation(conversation).build();
        faq = Document.builder().id(2L).filename("faq.txt").conversation(conversation).build();
    }

    @Test
    @DisplayName("Passages are labelled with their source and kept in rank order")
    void build_labelsPassagesInOrder() {
        // Given
        List<ScoredChunk> passages = List.of(
                passage(guide, 0, "Install with brew.", 0.9),
                passage(faq, 3, "Restart after install.", 0.8));

        // When
        ContextBuilder.BuiltContext context = contextBuilder.build(passages);

        // Then
        assertThat(context.getText()).isEqualTo(
                "[Source 1: guide.md (document 1)]\nInstall with brew.\n\n"
                        + "[Source 2: faq.txt (document 2)]\nRestart after install.");
        assertThat(context.getPassages()).hasSize(2);
        assertThat(context.getDocumentNames()).containsExactly("guide.md", "faq.txt");
    }

    @Test
    @DisplayName("Lower ranked passages are dropped once the budget is used up")
    void build_respectsCharacterBudget() {
        appProperties.getContext().setMaxChars(120);

        ContextBuilder.BuiltContext context = contextBuilder.build(List.of(
                passage(guide, 0, "x".repeat(60), 0.9),
                passage(faq, 0, "y".repeat(60), 0.8)));

        assertThat(context.length()).isLessThanOrEqualTo(120);
        assertThat(context.getPassages()).hasSize(1);
        assertThat(context.getDocumentNames()).containsExactly("guide.md");
    }

    @Test
    @DisplayName("A single over-long best passage is truncated to fit")
    void build_truncatesOverlongFirstPassage() {
        appProperties.getContext().setMaxChars(100);

        ContextBuilder.BuiltContext context = contextBuilder.build(List.of(passage(guide, 0, "z".repeat(500), 0.9)));

        assertThat(context.length()).isEqualTo(100);
        assertThat(context.getText()).startsWith("[Source 1: guide.md (document 1)]\nzzz");
    }

    @Test
    void build_withNoPassages_isEmpty() {
        ContextBuilder.BuiltContext context = contextBuilder.build(List.of());

        assertThat(context.getText()).isEmpty();
        assertThat(context.getDocumentNames()).isEmpty();
    }

    private static ScoredChunk passage(Document document, int index, String content, double score) {
        return new ScoredChunk(DocumentChunk.of(document, index, content, List.of(1.0)), score);
    }
}
