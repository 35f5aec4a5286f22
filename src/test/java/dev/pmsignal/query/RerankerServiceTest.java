package dev.pmsignal.query;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.pmsignal.feedback.SourceType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RerankerServiceTest {

    @Mock
    ScoringModel scoringModel;

    @InjectMocks
    RerankerService rerankerService;

    @Test
    void reranksCandidatesByScore() {
        var candidates = List.of(
                candidate("text A", 0.7),
                candidate("text B", 0.8),
                candidate("text C", 0.6)
        );
        given(scoringModel.scoreAll(anyList(), anyString()))
                .willReturn(Response.from(List.of(0.8, 0.2, 0.5)));

        List<RetrievedFeedback> results = rerankerService.rerank("why is login slow", candidates, 10);

        assertThat(results).hasSize(3);
        assertThat(results).extracting(RetrievedFeedback::rerankScore).containsExactly(0.8, 0.5, 0.2);
        assertThat(results).extracting(RetrievedFeedback::text)
                .containsExactly("text A", "text C", "text B");
    }

    @Test
    void respectsMaxResultsLimit() {
        var candidates = List.of(
                candidate("text A", 0.9),
                candidate("text B", 0.8),
                candidate("text C", 0.7),
                candidate("text D", 0.6),
                candidate("text E", 0.5)
        );
        given(scoringModel.scoreAll(anyList(), anyString()))
                .willReturn(Response.from(List.of(0.1, 0.9, 0.5, 0.3, 0.7)));

        List<RetrievedFeedback> results = rerankerService.rerank("query", candidates, 2);

        assertThat(results).hasSize(2);
        assertThat(results.get(0).rerankScore()).isEqualTo(0.9);
        assertThat(results.get(1).rerankScore()).isEqualTo(0.7);
    }

    @SuppressWarnings("unchecked")
    @Test
    void scoresQuestionAgainstChunkText() {
        var candidates = List.of(candidate("export crashes", 0.9));
        given(scoringModel.scoreAll(anyList(), anyString()))
                .willReturn(Response.from(List.of(0.4)));

        rerankerService.rerank("what breaks exports", candidates, 5);

        ArgumentCaptor<List<TextSegment>> segments = ArgumentCaptor.forClass(List.class);
        verify(scoringModel).scoreAll(segments.capture(), eq("what breaks exports"));
        assertThat(segments.getValue()).extracting(TextSegment::text).containsExactly("export crashes");
    }

    @Test
    void keepsRetrievalFieldsWhenScoring() {
        var candidates = List.of(candidate("text A", 0.7));
        given(scoringModel.scoreAll(anyList(), anyString()))
                .willReturn(Response.from(List.of(0.3)));

        RetrievedFeedback result = rerankerService.rerank("q", candidates, 5).get(0);

        assertThat(result.similarity()).isEqualTo(0.7);
        assertThat(result.sourceType()).isEqualTo(SourceType.JIRA);
        assertThat(result.sourceFile()).isEqualTo("tickets.csv");
    }

    @Test
    void emptyCandidatesReturnEmptyWithoutScoring() {
        assertThat(rerankerService.rerank("q", List.of(), 5)).isEmpty();
        verifyNoInteractions(scoringModel);
    }

    @Test
    void propagatesScoringFailure() {
        var candidates = List.of(candidate("text A", 0.7));
        given(scoringModel.scoreAll(anyList(), anyString()))
                .willThrow(new IllegalStateException("onnx failure"));

        assertThatThrownBy(() -> rerankerService.rerank("q", candidates, 5))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("onnx failure");
    }

    private static RetrievedFeedback candidate(String text, double similarity) {
        return new RetrievedFeedback(
                text, "tickets.csv", SourceType.JIRA, null, similarity, similarity * 1.25, null);
    }
}
