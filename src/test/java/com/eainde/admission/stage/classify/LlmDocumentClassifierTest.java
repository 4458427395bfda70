package com.eainde.admission.stage.classify;

import com.eainde.admission.exception.StageExecutionException;
import com.eainde.admission.model.ApplicationStage;
import com.eainde.admission.model.ClassifiedDocument;
import com.eainde.admission.model.DocumentDescriptor;
import com.eainde.admission.model.DocumentLabel;
import com.eainde.admission.repository.InMemoryDocumentStore;
import com.eainde.admission.stage.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmDocumentClassifierTest {

    @Mock
    private DocumentClassificationAssistant assistant;

    private InMemoryDocumentStore store;
    private LlmDocumentClassifier classifier;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        DocumentTextExtractor plainText = (descriptor, content) -> new String(content, StandardCharsets.UTF_8);
        RetryPolicy retry = new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO);
        classifier = new LlmDocumentClassifier(assistant, plainText, store, new ObjectMapper(), retry, 0.5, 1000);
    }

    private DocumentDescriptor upload(String id, String filename, String text) {
        store.put(id, text.getBytes(StandardCharsets.UTF_8));
        return new DocumentDescriptor(id, filename, "application/pdf", text.length());
    }

    @Nested
    @DisplayName("label mapping")
    class Labels {

        @Test
        @DisplayName("confident answers keep their label")
        void confident() {
            DocumentDescriptor doc = upload("DOC-1", "abitur.pdf", "Zeugnis der allgemeinen Hochschulreife");
            when(assistant.classify(anyString(), eq("abitur.pdf"), anyString())).thenReturn("""
                    ```json
                    {"document_type": "qualification-certificate", "confidence": 0.95, "reasoning": "Abitur"}
                    ```""");

            List<ClassifiedDocument> result = classifier.execute(List.of(doc));

            assertThat(result).singleElement().satisfies(c -> {
                assertThat(c.label()).isEqualTo(DocumentLabel.QUALIFICATION_CERTIFICATE);
                assertThat(c.confidence()).isEqualTo(0.95);
                assertThat(c.document()).isEqualTo(doc);
            });
        }

        @Test
        @DisplayName("unseen labels and low confidence fall back to other")
        void fallbacks() {
            DocumentDescriptor passport = upload("DOC-1", "passport.pdf", "Passport");
            DocumentDescriptor blurry = upload("DOC-2", "scan.pdf", "???");
            DocumentDescriptor cv = upload("DOC-3", "cv.pdf", "Curriculum vitae");
            when(assistant.classify(anyString(), eq("passport.pdf"), anyString()))
                    .thenReturn("{\"document_type\": \"passport\", \"confidence\": 0.9}");
            when(assistant.classify(anyString(), eq("scan.pdf"), anyString()))
                    .thenReturn("{\"document_type\": \"transcript\", \"confidence\": 0.3}");
            when(assistant.classify(anyString(), eq("cv.pdf"), anyString()))
                    .thenReturn("{\"document_type\": \"cv\", \"confidence\": 0.8}");

            List<ClassifiedDocument> result = classifier.execute(List.of(passport, blurry, cv));

            assertThat(result).extracting(ClassifiedDocument::label)
                    .containsExactly(DocumentLabel.OTHER, DocumentLabel.OTHER, DocumentLabel.CV);
            assertThat(result.get(0).reasoning()).contains("passport");
            assertThat(result.get(1).confidence()).isEqualTo(0.3);
        }

        @Test
        @DisplayName("unparsable answers become other with confidence 0.1")
        void unparsable() {
            DocumentDescriptor odd = upload("DOC-1", "odd.pdf", "odd");
            DocumentDescriptor cv = upload("DOC-2", "cv.pdf", "Curriculum vitae");
            when(assistant.classify(anyString(), eq("odd.pdf"), anyString())).thenReturn("I think it is a CV");
            when(assistant.classify(anyString(), eq("cv.pdf"), anyString()))
                    .thenReturn("{\"document_type\": \"cv\", \"confidence\": 0.9}");

            List<ClassifiedDocument> result = classifier.execute(List.of(odd, cv));

            assertThat(result.get(0).label()).isEqualTo(DocumentLabel.OTHER);
            assertThat(result.get(0).confidence()).isEqualTo(0.1);
        }

        @Test
        @DisplayName("only the first 1000 characters are sent, with the vocabulary")
        void excerpt() {
            DocumentDescriptor doc = upload("DOC-1", "long.pdf", "x".repeat(5000));
            when(assistant.classify(anyString(), anyString(), anyString()))
                    .thenReturn("{\"document_type\": \"transcript\", \"confidence\": 0.7}");

            classifier.execute(List.of(doc));

            verify(assistant).classify(argThat(labels -> labels.contains("work-certificate")), eq("long.pdf"),
                    argThat(excerpt -> excerpt.length() == 1000));
        }
    }

    @Nested
    @DisplayName("stage failures")
    class Failures {

        @Test
        @DisplayName("fails when no document is classified confidently")
        void noConfidentDocument() {
            DocumentDescriptor doc = upload("DOC-1", "scan.pdf", "???");
            when(assistant.classify(anyString(), anyString(), anyString()))
                    .thenReturn("{\"document_type\": \"cv\", \"confidence\": 0.2}");

            assertThatThrownBy(() -> classifier.execute(List.of(doc)))
                    .isInstanceOf(StageExecutionException.class)
                    .hasMessage("No documents classified with sufficient confidence");
        }

        @Test
        @DisplayName("a model that keeps failing fails the stage after the retries")
        void modelDown() {
            DocumentDescriptor doc = upload("DOC-1", "cv.pdf", "cv");
            when(assistant.classify(anyString(), anyString(), anyString())).thenThrow(new RuntimeException("503"));

            assertThatThrownBy(() -> classifier.execute(List.of(doc)))
                    .isInstanceOf(StageExecutionException.class)
                    .extracting(e -> ((StageExecutionException) e).getStage())
                    .isEqualTo(ApplicationStage.CLASSIFYING);
            verify(assistant, times(2)).classify(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("missing document bytes fail the stage")
        void missingBlob() {
            DocumentDescriptor ghost = new DocumentDescriptor("DOC-404", "ghost.pdf", "application/pdf", 10);

            assertThatThrownBy(() -> classifier.execute(List.of(ghost)))
                    .isInstanceOf(StageExecutionException.class)
                    .hasMessageContaining("DOC-404");
        }
    }

    @Test
    @DisplayName("PDFs are recognized by content type, extension or magic bytes")
    void pdfDetection() {
        byte[] magic = "%PDF-1.7".getBytes(StandardCharsets.US_ASCII);
        byte[] plain = "hello".getBytes(StandardCharsets.US_ASCII);

        assertThat(PdfBoxDocumentTextExtractor.isPdf(new DocumentDescriptor(null, "a.bin", "application/pdf", 5), plain)).isTrue();
        assertThat(PdfBoxDocumentTextExtractor.isPdf(new DocumentDescriptor(null, "A.PDF", null, 5), plain)).isTrue();
        assertThat(PdfBoxDocumentTextExtractor.isPdf(new DocumentDescriptor(null, "upload", "application/octet-stream", 8), magic)).isTrue();
        assertThat(PdfBoxDocumentTextExtractor.isPdf(new DocumentDescriptor(null, "photo.jpg", "image/jpeg", 5), plain)).isFalse();
    }

    @Test
    @DisplayName("text uploads are decoded and images yield no text")
    void textExtraction() {
        PdfBoxDocumentTextExtractor extractor = new PdfBoxDocumentTextExtractor();
        byte[] text = "Transcript of records".getBytes(StandardCharsets.UTF_8);

        assertThat(extractor.extractText(new DocumentDescriptor("DOC-1", "t.txt", "text/plain", text.length), text))
                .isEqualTo("Transcript of records");
        assertThat(extractor.extractText(new DocumentDescriptor("DOC-2", "p.jpg", "image/jpeg", 3), new byte[]{1, 2, 3}))
                .isEmpty();
        assertThat(extractor.extractText(new DocumentDescriptor("DOC-3", "broken.pdf", "application/pdf", 4),
                "%PDF".getBytes(StandardCharsets.US_ASCII))).isEmpty();
    }
}
