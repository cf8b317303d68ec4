package com.budgetpilot.categorization.suggestion;

import com.budgetpilot.categorization.CategorizationException;
import com.budgetpilot.domain.CategorizationJob;
import com.budgetpilot.domain.CategorizationJobRepository;
import com.budgetpilot.domain.CategorizationSuggestion;
import com.budgetpilot.domain.CategorizationSuggestionRepository;
import com.budgetpilot.domain.MatchType;
import com.budgetpilot.domain.SkippedTransactionRepository;
import com.budgetpilot.domain.SuggestedCategory;
import com.budgetpilot.domain.SuggestionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SuggestionStoreTest {

    private static final String USER = "user-1";
    private static final String JOB = "job-1";

    @Mock
    CategorizationSuggestionRepository suggestionRepository;
    @Mock
    SkippedTransactionRepository skippedRepository;
    @Mock
    CategorizationJobRepository jobRepository;

    @InjectMocks
    SuggestionStore store;

    private static CategorizationSuggestion.AffectedTransaction tx(String id) {
        return new CategorizationSuggestion.AffectedTransaction(id, "STARBUCKS " + id, -450L, LocalDate.of(2025, 3, 1));
    }

    private static SuggestionDraft draft(String keyword, String... ids) {
        return new SuggestionDraft(
                new SuggestedCategory.Proposed("Coffee", "coffee", "#795548"),
                new CategorizationSuggestion.Match(MatchType.CONTAINS, keyword),
                java.util.Arrays.stream(ids).map(SuggestionStoreTest::tx).toList());
    }

    @Test
    @DisplayName("append inserts a new PENDING suggestion when no pending one has the keyword")
    void appendInsertsNew() {
        when(suggestionRepository.findHeldAmong(eq(USER), any(), isNull())).thenReturn(Set.of());
        when(suggestionRepository.appendToPending(eq(USER), eq("STARBUCKS"), eq(JOB), eq(1), any())).thenReturn(Optional.empty());
        when(suggestionRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        Optional<CategorizationSuggestion> stored = store.append(USER, JOB, 1, draft(" Starbucks ", "tx-1", "tx-2"));

        assertThat(stored).isPresent();
        CategorizationSuggestion s = stored.get();
        assertThat(s.getStatus()).isEqualTo(SuggestionStatus.PENDING);
        assertThat(s.getMatchKey()).isEqualTo("STARBUCKS");
        assertThat(s.getTransactionIds()).containsExactly("tx-1", "tx-2");
        assertThat(s.getAffectedCount()).isEqualTo(2);
        assertThat(s.getBatchNumber()).isEqualTo(1);
        assertThat(s.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("append merges into the existing PENDING suggestion with the same keyword instead of duplicating")
    void appendMergesIntoPending() {
        CategorizationSuggestion existing = new CategorizationSuggestion();
        existing.setId("s-1");
        when(suggestionRepository.findHeldAmong(eq(USER), any(), isNull())).thenReturn(Set.of());
        when(suggestionRepository.appendToPending(eq(USER), eq("STARBUCKS"), eq(JOB), eq(2), any())).thenReturn(Optional.of(existing));

        Optional<CategorizationSuggestion> stored = store.append(USER, JOB, 2, draft("starbucks", "tx-3"));

        assertThat(stored).containsSame(existing);
        verify(suggestionRepository, never()).save(any());
    }

    @Test
    @DisplayName("transactions already held by another pending suggestion are dropped; fully held drafts are discarded")
    @SuppressWarnings("unchecked")
    void appendDropsOwnedTransactions() {
        when(suggestionRepository.findHeldAmong(eq(USER), any(), isNull())).thenReturn(Set.of("tx-1"));
        when(suggestionRepository.appendToPending(anyString(), anyString(), anyString(), anyInt(), any())).thenReturn(Optional.empty());
        when(suggestionRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        Optional<CategorizationSuggestion> stored = store.append(USER, JOB, 1, draft("UBER", "tx-1", "tx-2", "tx-2"));
        assertThat(stored).isPresent();
        assertThat(stored.get().getTransactionIds()).containsExactly("tx-2");

        ArgumentCaptor<List<CategorizationSuggestion.AffectedTransaction>> appended = ArgumentCaptor.forClass(List.class);
        verify(suggestionRepository).appendToPending(eq(USER), eq("UBER"), eq(JOB), eq(1), appended.capture());
        assertThat(appended.getValue()).extracting(CategorizationSuggestion.AffectedTransaction::getId).containsExactly("tx-2");
    }

    @Test
    @DisplayName("append returns empty when every transaction is already suggested")
    void appendDiscardsFullyOwnedDraft() {
        when(suggestionRepository.findHeldAmong(eq(USER), any(), isNull())).thenReturn(Set.of("tx-1"));

        assertThat(store.append(USER, JOB, 1, draft("UBER", "tx-1"))).isEmpty();
        verify(suggestionRepository, never()).appendToPending(any(), any(), any(), anyInt(), any());
        verify(suggestionRepository, never()).save(any());
    }

    @Test
    @DisplayName("claim maps a lost compare-and-swap to ALREADY_RESOLVED and a missing suggestion to NOT_FOUND")
    void claimErrors() {
        when(suggestionRepository.claim(USER, "s-1", SuggestionStatus.APPROVED, null)).thenReturn(Optional.empty());
        when(suggestionRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(new CategorizationSuggestion()));
        when(suggestionRepository.claim(USER, "missing", SuggestionStatus.APPROVED, null)).thenReturn(Optional.empty());
        when(suggestionRepository.findByIdAndUserId("missing", USER)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.claim(USER, "s-1", SuggestionStatus.APPROVED, null))
                .isInstanceOf(CategorizationException.class)
                .extracting("errorCode").isEqualTo(CategorizationException.ALREADY_RESOLVED);
        assertThatThrownBy(() -> store.claim(USER, "missing", SuggestionStatus.APPROVED, null))
                .isInstanceOf(CategorizationException.class)
                .extracting("errorCode").isEqualTo(CategorizationException.NOT_FOUND);
    }

    @Test
    @DisplayName("listPending is partial while the user's job is PROCESSING")
    void listPendingPartial() {
        CategorizationJob job = new CategorizationJob();
        job.setStatus(CategorizationJob.JobStatus.PROCESSING);
        when(suggestionRepository.findByUserIdAndStatusOrderByCreatedAtAsc(USER, SuggestionStatus.PENDING))
                .thenReturn(List.of(new CategorizationSuggestion(), new CategorizationSuggestion()));
        when(skippedRepository.findByUserIdOrderByCreatedAtAsc(USER)).thenReturn(List.of());
        when(jobRepository.findByUserId(USER)).thenReturn(Optional.of(job));

        SuggestionsView view = store.listPending(USER);

        assertThat(view.partial()).isTrue();
        assertThat(view.totalPending()).isEqualTo(2);
        assertThat(view.totalSkipped()).isZero();
    }

    @Test
    @DisplayName("clearAll deletes pending suggestions and skipped records and returns both counts")
    void clearAll() {
        when(suggestionRepository.deleteByUserIdAndStatus(USER, SuggestionStatus.PENDING)).thenReturn(5L);
        when(skippedRepository.deleteByUserId(USER)).thenReturn(3L);

        assertThat(store.clearAll(USER)).isEqualTo(new ClearResult(5, 3));
    }

    @Test
    @DisplayName("clearSkipped with no ids does not touch the repository")
    void clearSkippedNoIds() {
        assertThat(store.clearSkipped(USER, List.of())).isZero();
        verify(skippedRepository, never()).deleteByUserIdAndTransactionIdIn(any(), any());
    }

    private static CategorizationSuggestion approvedUncommitted(String id, String... txIds) {
        CategorizationSuggestion s = new CategorizationSuggestion();
        s.setId(id);
        s.setUserId(USER);
        s.setStatus(SuggestionStatus.APPROVED);
        s.setAffectedTransactions(new java.util.ArrayList<>(java.util.Arrays.stream(txIds).map(SuggestionStoreTest::tx).toList()));
        s.setTransactionIds(new java.util.ArrayList<>(List.of(txIds)));
        return s;
    }

    @Test
    @DisplayName("release reopens a failed approval with all its transactions when nothing else took them")
    @SuppressWarnings("unchecked")
    void releaseReopensWithAllTransactions() {
        when(suggestionRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(approvedUncommitted("s-1", "tx-1", "tx-2")));
        when(suggestionRepository.findHeldAmong(USER, List.of("tx-1", "tx-2"), "s-1")).thenReturn(Set.of());
        when(suggestionRepository.reopen(eq("s-1"), any())).thenReturn(true);

        assertThat(store.release(USER, "s-1")).isTrue();

        ArgumentCaptor<List<CategorizationSuggestion.AffectedTransaction>> kept = ArgumentCaptor.forClass(List.class);
        verify(suggestionRepository).reopen(eq("s-1"), kept.capture());
        assertThat(kept.getValue()).extracting(CategorizationSuggestion.AffectedTransaction::getId).containsExactly("tx-1", "tx-2");
    }

    @Test
    @DisplayName("a batch that picked up transactions of an approval in progress keeps them when the approval is undone")
    @SuppressWarnings("unchecked")
    void releaseLeavesTransactionsTakenByAnotherSuggestion() {
        when(suggestionRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(approvedUncommitted("s-1", "tx-1", "tx-2", "tx-3")));
        when(suggestionRepository.findHeldAmong(USER, List.of("tx-1", "tx-2", "tx-3"), "s-1")).thenReturn(Set.of("tx-2"));
        when(suggestionRepository.reopen(eq("s-1"), any())).thenReturn(true);

        assertThat(store.release(USER, "s-1")).isTrue();

        ArgumentCaptor<List<CategorizationSuggestion.AffectedTransaction>> kept = ArgumentCaptor.forClass(List.class);
        verify(suggestionRepository).reopen(eq("s-1"), kept.capture());
        assertThat(kept.getValue()).extracting(CategorizationSuggestion.AffectedTransaction::getId).containsExactly("tx-1", "tx-3");
    }

    @Test
    @DisplayName("release withdraws the approval instead of reopening it when every transaction is held elsewhere")
    void releaseWithdrawsWhenNothingLeft() {
        when(suggestionRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(approvedUncommitted("s-1", "tx-1", "tx-2")));
        when(suggestionRepository.findHeldAmong(USER, List.of("tx-1", "tx-2"), "s-1")).thenReturn(Set.of("tx-1", "tx-2"));

        assertThat(store.release(USER, "s-1")).isFalse();

        verify(suggestionRepository).withdraw("s-1", SuggestionStore.WITHDRAWN_REASON);
        verify(suggestionRepository, never()).reopen(any(), any());
    }

    @Test
    @DisplayName("release ignores suggestions whose commit was already recorded")
    void releaseIgnoresCommittedApproval() {
        CategorizationSuggestion committed = approvedUncommitted("s-1", "tx-1");
        committed.setCommittedCategoryId("cat-1");
        when(suggestionRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(committed));

        assertThat(store.release(USER, "s-1")).isFalse();

        verify(suggestionRepository, never()).findHeldAmong(any(), any(), any());
        verify(suggestionRepository, never()).reopen(any(), any());
    }
}
