package com.costguard.anomaly.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.costguard.anomaly.model.AnomalyRecord;
import com.costguard.anomaly.model.AnomalyReport;
import com.costguard.anomaly.model.DetectionRun;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnomalyNotificationDispatcherTest {

    @Mock
    private AnomalyNotifier primary;

    @Mock
    private AnomalyNotifier secondary;

    @Mock
    private AnomalyNotifier disabled;

    private final AlertMessageRenderer renderer = new AlertMessageRenderer(10);

    @BeforeEach
    void setUp() {
        lenient().when(primary.isEnabled()).thenReturn(true);
        lenient().when(secondary.isEnabled()).thenReturn(true);
        lenient().when(disabled.isEnabled()).thenReturn(false);
    }

    @Test
    void sendsEveryReportToEveryEnabledChannel() {
        AnomalyNotificationDispatcher dispatcher = new AnomalyNotificationDispatcher(
                List.of(primary, secondary, disabled), renderer, AnomalyRecord.Severity.WARNING);
        DetectionRun run = NotificationFixtures.run(
                NotificationFixtures.spike(AnomalyRecord.Severity.WARNING),
                NotificationFixtures.degradedDrop());

        int delivered = dispatcher.dispatch(run);

        assertThat(delivered).isEqualTo(4);
        ArgumentCaptor<AlertMessage> messages = ArgumentCaptor.forClass(AlertMessage.class);
        verify(primary, times(2)).send(messages.capture());
        assertThat(messages.getAllValues())
                .extracting(AlertMessage::subject)
                .containsExactly(
                        "AWS Cost Anomaly - WARNING SPIKE on 2024-03-27",
                        "AWS Cost Anomaly - CRITICAL DROP on 2024-03-12");
        verify(secondary, times(2)).send(any());
        verify(disabled, never()).send(any());
    }

    @Test
    void skipsReportsBelowMinimumSeverity() {
        AnomalyNotificationDispatcher dispatcher = new AnomalyNotificationDispatcher(
                List.of(primary), renderer, AnomalyRecord.Severity.CRITICAL);
        AnomalyReport warning = NotificationFixtures.spike(AnomalyRecord.Severity.WARNING);
        AnomalyReport critical = NotificationFixtures.degradedDrop();

        int delivered = dispatcher.dispatch(NotificationFixtures.run(warning, critical));

        assertThat(delivered).isEqualTo(1);
        ArgumentCaptor<AlertMessage> message = ArgumentCaptor.forClass(AlertMessage.class);
        verify(primary).send(message.capture());
        assertThat(message.getValue().subject()).contains("CRITICAL DROP");
    }

    @Test
    void failingChannelDoesNotBlockOthers() {
        when(primary.name()).thenReturn("sns");
        doThrow(new IllegalStateException("topic not found")).when(primary).send(any());
        AnomalyNotificationDispatcher dispatcher = new AnomalyNotificationDispatcher(
                List.of(primary, secondary), renderer, AnomalyRecord.Severity.WARNING);

        int delivered = dispatcher.dispatch(NotificationFixtures.run(
                NotificationFixtures.spike(AnomalyRecord.Severity.CRITICAL)));

        assertThat(delivered).isEqualTo(1);
        verify(secondary).send(any());
    }

    @Test
    void runWithoutAnomaliesSendsNothing() {
        AnomalyNotificationDispatcher dispatcher = new AnomalyNotificationDispatcher(
                List.of(primary), renderer, AnomalyRecord.Severity.WARNING);

        assertThat(dispatcher.dispatch(NotificationFixtures.run())).isZero();
        verify(primary, never()).send(any());
    }

    @Test
    void listsOnlyEnabledChannels() {
        when(primary.name()).thenReturn("log");
        AnomalyNotificationDispatcher dispatcher = new AnomalyNotificationDispatcher(
                List.of(primary, disabled), renderer, AnomalyRecord.Severity.WARNING);

        assertThat(dispatcher.activeChannels()).containsExactly("log");
    }
}
