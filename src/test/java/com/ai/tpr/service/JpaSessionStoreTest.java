package com.ai.tpr.service;

import com.ai.tpr.calculation.AgeGroup;
import com.ai.tpr.calculation.FacilityLevel;
import com.ai.tpr.conversation.CompletionReason;
import com.ai.tpr.conversation.Selections;
import com.ai.tpr.conversation.Session;
import com.ai.tpr.conversation.WorkflowStage;
import com.ai.tpr.exception.SessionConflictException;
import com.ai.tpr.repository.WorkflowSessionRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest(properties = "tpr.session-store=jpa")
@Import(JpaSessionStore.class)
class JpaSessionStoreTest {

    @Autowired
    private JpaSessionStore store;

    @Autowired
    private WorkflowSessionRepository repository;

    @Test
    void savesAndLoadsAllFields() {
        Session session = new Session("call-1");
        session.setStage(WorkflowStage.COMPLETE);
        session.setSelections(new Selections("Adamawa", FacilityLevel.PRIMARY, AgeGroup.UNDER_FIVE));
        session.setDatasetHandle("upload-7");
        session.setCompletionReason(CompletionReason.CALCULATED);

        Session saved = store.save("call-1", session);
        Session loaded = store.load("call-1").orElseThrow();

        assertThat(saved.getVersion()).isZero();
        assertThat(loaded.sameStateAs(session)).isTrue();
        assertThat(loaded.getVersion()).isZero();
        assertThat(repository.findBySessionId("call-1").orElseThrow().getCreatedAt()).isNotNull();
    }

    @Test
    void incrementsVersionOnUpdate() {
        Session first = store.save("call-1", new Session("call-1"));
        first.setStage(WorkflowStage.STATE_SELECTION);

        Session second = store.save("call-1", first);

        assertThat(second.getVersion()).isEqualTo(1L);
        assertThat(store.load("call-1").orElseThrow().getStage()).isEqualTo(WorkflowStage.STATE_SELECTION);
    }

    @Test
    void unchangedSaveStillBumpsVersion() {
        Session first = store.save("call-1", new Session("call-1"));

        Session second = store.save("call-1", first);

        assertThat(second.getVersion()).isEqualTo(1L);
        assertThat(store.load("call-1").orElseThrow().getVersion()).isEqualTo(1L);
    }

    @Test
    void missingSessionLoadsEmpty() {
        assertThat(store.load("nobody")).isEmpty();
    }

    @Test
    void deleteRemovesRow() {
        store.save("call-1", new Session("call-1"));

        store.delete("call-1");

        assertThat(store.load("call-1")).isEmpty();
    }

    @Test
    void rejectsStaleVersion() {
        Session saved = store.save("call-1", new Session("call-1"));
        Session stale = saved.copy();
        store.save("call-1", saved);

        assertThatThrownBy(() -> store.save("call-1", stale)).isInstanceOf(SessionConflictException.class);
    }

    @Test
    void rejectsSecondCreate() {
        store.save("call-1", new Session("call-1"));

        assertThatThrownBy(() -> store.save("call-1", new Session("call-1"))).isInstanceOf(SessionConflictException.class);
    }
}
