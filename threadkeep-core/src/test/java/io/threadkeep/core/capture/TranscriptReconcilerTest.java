package io.threadkeep.core.capture;

import static org.assertj.core.api.Assertions.assertThat;

import io.threadkeep.core.model.ConversationSnapshot;
import io.threadkeep.core.model.Fragment;
import io.threadkeep.core.model.Message;
import io.threadkeep.core.model.MessageRole;
import java.util.List;
import org.junit.jupiter.api.Test;

class TranscriptReconcilerTest {

    private final TranscriptReconciler reconciler = new TranscriptReconciler();

    @Test
    void shouldReturnIncomingWhenCanonicalIsEmpty() {
        List<Message> incoming = List.of(Message.user("A"), Message.assistant("B"));

        assertThat(reconciler.merge(List.of(), incoming)).containsExactlyElementsOf(incoming);
    }

    @Test
    void shouldReplaceWithLongerVersionInPlace() {
        String partial = "P".repeat(100) + "art one";
        String complete = "P".repeat(100) + "art one, now fully rendered";
        List<Message> canonical = List.of(Message.user("Q"), Message.assistant(partial));

        List<Message> merged = reconciler.merge(canonical, List.of(Message.assistant(complete)));

        assertThat(merged).containsExactly(Message.user("Q"), Message.assistant(complete));
    }

    @Test
    void shouldKeepLongerExistingVersion() {
        String longer = "S".repeat(100) + " with the full tail";
        String shorter = "S".repeat(100);
        List<Message> canonical = List.of(Message.assistant(longer));

        assertThat(reconciler.merge(canonical, List.of(Message.assistant(shorter))))
            .containsExactly(Message.assistant(longer));
    }

    @Test
    void shouldAppendUnmatchedMessagesInAdmissionOrder() {
        List<Message> canonical = List.of(Message.user("Q1"), Message.assistant("A1"));

        List<Message> merged = reconciler.merge(
            canonical,
            List.of(Message.assistant("A1"), Message.user("Q2"), Message.assistant("A2"))
        );

        assertThat(merged).extracting(Message::content).containsExactly("Q1", "A1", "Q2", "A2");
    }

    @Test
    void shouldCollapseDuplicatesWithinOneIncomingBatch() {
        List<Message> canonical = List.of(Message.user("Q1"));

        List<Message> merged = reconciler.merge(
            canonical,
            List.of(Message.assistant("Same answer"), Message.assistant("same answer"))
        );

        assertThat(merged).extracting(Message::content).containsExactly("Q1", "Same answer");
    }

    @Test
    void shouldAppendGrownMessageWhenPrefixFingerprintDiffers() {
        List<Message> canonical = List.of(Message.user("Q"), Message.assistant("Hel"));

        List<Message> merged = reconciler.merge(canonical, List.of(Message.assistant("Hello there")));

        assertThat(merged).extracting(Message::content).containsExactly("Q", "Hel", "Hello there");
    }

    @Test
    void shouldBeIdempotent() {
        List<Message> canonical = List.of(Message.user("Q1"), Message.assistant("A1"));
        List<Message> incoming = List.of(Message.user("Q1"), Message.assistant("A1 extended"), Message.user("Q2"));

        List<Message> once = reconciler.merge(canonical, incoming);
        List<Message> twice = reconciler.merge(once, incoming);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void shouldNeverShrinkTranscript() {
        List<Message> canonical = List.of(Message.user("Q1"), Message.assistant("A1"), Message.user("Q2"));

        List<Message> merged = reconciler.merge(canonical, List.of(Message.user("Q1")));

        assertThat(merged).hasSizeGreaterThanOrEqualTo(canonical.size());
        assertThat(merged).containsExactlyElementsOf(canonical);
    }

    @Test
    void shouldAssembleInPositionOrderAndDropEmptyText() {
        ConversationSnapshot snapshot = reconciler.assemble(List.of(
            new Fragment(MessageRole.ASSISTANT, "Answer", 240),
            new Fragment(MessageRole.USER, "Question\n\nC3 selected", 120),
            new Fragment(MessageRole.ASSISTANT, "   ", 300)
        ));

        assertThat(snapshot.messages()).containsExactly(Message.user("Question"), Message.assistant("Answer"));
        assertThat(snapshot.digest())
            .isEqualTo(Fingerprints.rollingHash("Question\n\nC3 selected|||Answer|||   "));
    }

    @Test
    void shouldRejectWhenCaptureIsDisabled() {
        CaptureContext context = new CaptureContext(false);

        ReconcileOutcome outcome = reconciler.reconcile(context, List.of(), pair("Q", "A"));

        assertThat(outcome).isEqualTo(new ReconcileOutcome.NoUpdate(ReconcileOutcome.Reason.CAPTURE_DISABLED));
    }

    @Test
    void shouldRejectFewerThanTwoFragments() {
        ReconcileOutcome outcome = reconciler.reconcile(
            new CaptureContext(),
            List.of(),
            List.of(new Fragment(MessageRole.USER, "Q", 1))
        );

        assertThat(outcome).isEqualTo(new ReconcileOutcome.NoUpdate(ReconcileOutcome.Reason.TOO_FEW_FRAGMENTS));
    }

    @Test
    void shouldRejectSnapshotWithoutRolePair() {
        ReconcileOutcome outcome = reconciler.reconcile(
            new CaptureContext(),
            List.of(),
            List.of(new Fragment(MessageRole.USER, "Q1", 1), new Fragment(MessageRole.USER, "Q2", 2))
        );

        assertThat(outcome).isEqualTo(new ReconcileOutcome.NoUpdate(ReconcileOutcome.Reason.MISSING_ROLE_PAIR));
    }

    @Test
    void shouldRejectPairThatIsBlankAfterNormalization() {
        ReconcileOutcome outcome = reconciler.reconcile(
            new CaptureContext(),
            List.of(),
            List.of(new Fragment(MessageRole.USER, "Q1", 1), new Fragment(MessageRole.ASSISTANT, "\nA1 selected", 2))
        );

        assertThat(outcome).isEqualTo(new ReconcileOutcome.NoUpdate(ReconcileOutcome.Reason.MISSING_ROLE_PAIR));
    }

    @Test
    void shouldSkipUnchangedSnapshotAndAcceptAfterReset() {
        CaptureContext context = new CaptureContext();
        List<Fragment> fragments = pair("Q", "A");

        ReconcileOutcome first = reconciler.reconcile(context, List.of(), fragments);
        ReconcileOutcome second = reconciler.reconcile(context, List.of(), fragments);
        context.reset();
        ReconcileOutcome third = reconciler.reconcile(context, List.of(), fragments);

        assertThat(first).isInstanceOf(ReconcileOutcome.Updated.class);
        assertThat(second).isEqualTo(new ReconcileOutcome.NoUpdate(ReconcileOutcome.Reason.UNCHANGED));
        assertThat(third).isInstanceOf(ReconcileOutcome.Updated.class);
    }

    @Test
    void shouldNotRecordDigestOfRejectedSnapshot() {
        CaptureContext context = new CaptureContext();
        List<Fragment> userOnly = List.of(new Fragment(MessageRole.USER, "Q1", 1), new Fragment(MessageRole.USER, "Q2", 2));

        reconciler.reconcile(context, List.of(), userOnly);

        assertThat(context.lastDigest()).isEmpty();
    }

    @Test
    void shouldMergeAcceptedSnapshotIntoExistingTranscript() {
        CaptureContext context = new CaptureContext();
        List<Message> existing = List.of(Message.user("Q1"), Message.assistant("A1"));

        ReconcileOutcome outcome = reconciler.reconcile(context, existing, List.of(
            new Fragment(MessageRole.USER, "Q1", 10),
            new Fragment(MessageRole.ASSISTANT, "A1", 20),
            new Fragment(MessageRole.USER, "Q2", 30),
            new Fragment(MessageRole.ASSISTANT, "A2", 40)
        ));

        assertThat(outcome).isInstanceOf(ReconcileOutcome.Updated.class);
        ReconcileOutcome.Updated updated = (ReconcileOutcome.Updated) outcome;
        assertThat(updated.messages()).extracting(Message::content).containsExactly("Q1", "A1", "Q2", "A2");
        assertThat(context.lastDigest()).isEqualTo(updated.snapshot().digest());
    }

    private static List<Fragment> pair(String question, String answer) {
        return List.of(new Fragment(MessageRole.USER, question, 1), new Fragment(MessageRole.ASSISTANT, answer, 2));
    }
}
