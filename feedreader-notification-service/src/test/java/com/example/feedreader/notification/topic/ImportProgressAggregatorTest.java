package com.example.feedreader.notification.topic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

import com.example.feedreader.shared.broker.NotificationBroker;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ImportProgressAggregatorTest {

    private final ImportProgressAggregator aggregator = new ImportProgressAggregator();

    @Test
    @SuppressWarnings("unchecked")
    void format_reportsEveryImportWithPercentage() {
        // when
        var message = aggregator.format(Map.of("imp-2", "1/4", "imp-1", "0/0")).orElseThrow();

        // then
        assertThat(message.get("type")).isEqualTo("opml_import_progress");
        var imports = (List<Map<String, Object>>) message.get("imports");
        assertThat(imports).hasSize(2);
        assertThat(imports.get(0)).containsEntry("import_id", "imp-1").containsEntry("percentage", 100);
        assertThat(imports.get(1))
                .containsEntry("import_id", "imp-2")
                .containsEntry("current", 1L)
                .containsEntry("total", 4L)
                .containsEntry("percentage", 25);
    }

    @Test
    void format_malformedProgress_isSkipped() {
        assertThat(aggregator.format(Map.of("imp-1", "halfway"))).isEmpty();
    }

    @Test
    void merge_overwritesProgressOfImport() {
        // given
        var broker = mock(NotificationBroker.class);
        given(broker.putField("pending", "imp-1", "7/10")).willReturn(Mono.just(false));

        // when
        StepVerifier.create(aggregator.merge(broker, "pending", new ImportProgressDelta("imp-1", 7, 10)))
                .verifyComplete();

        // then
        then(broker).should().putField("pending", "imp-1", "7/10");
    }

    @Test
    void delta_currentBeyondTotal_isRejected() {
        assertThatThrownBy(() -> new ImportProgressDelta("imp-1", 11, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
