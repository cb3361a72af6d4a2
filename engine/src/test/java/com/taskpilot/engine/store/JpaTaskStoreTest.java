package com.taskpilot.engine.store;

import com.taskpilot.engine.model.IllegalTaskTransitionException;
import com.taskpilot.engine.model.Task;
import com.taskpilot.engine.model.TaskNotFoundException;
import com.taskpilot.engine.model.TaskStatus;
import com.taskpilot.engine.repository.TaskRepository;
import com.taskpilot.engine.support.TestTasks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaTaskStore with the repository mocked.
 */
@ExtendWith(MockitoExtension.class)
class JpaTaskStoreTest {

    @Mock TaskRepository taskRepo;

    JpaTaskStore store;

    @BeforeEach
    void setUp() {
        store = new JpaTaskStore(taskRepo);
    }

    // ------------------------------------------------------------------
    // Engine operations
    // ------------------------------------------------------------------

    @Test
    void get_missingTask_throws() {
        UUID id = UUID.randomUUID();
        when(taskRepo.findWithCommentsById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.get(id))
                .isInstanceOf(TaskNotFoundException.class)
                .hasMessageContaining(id.toString());
    }

    @Test
    void updateStatus_savesNewStatus() {
        Task task = TestTasks.task("t", TaskStatus.NEW);
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        store.updateStatus(task.getId(), TaskStatus.IN_PROGRESS);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
        verify(taskRepo).save(task);
    }

    @Test
    void appendComment_addsToThread() {
        Task task = TestTasks.task("t", TaskStatus.IN_PROGRESS);
        when(taskRepo.findWithCommentsById(task.getId())).thenReturn(Optional.of(task));

        store.appendComment(task.getId(), "taskpilot", "Working on it");

        assertThat(task.getComments()).singleElement()
                .satisfies(c -> {
                    assertThat(c.getAuthor()).isEqualTo("taskpilot");
                    assertThat(c.getContent()).isEqualTo("Working on it");
                    assertThat(c.getTask()).isSameAs(task);
                });
        verify(taskRepo).save(task);
    }

    @Test
    void listRecent_clampsLimitToAtLeastOne() {
        when(taskRepo.findByStatusInOrderByUpdatedAtDesc(any(), any())).thenReturn(List.of());

        store.listRecent(EnumSet.of(TaskStatus.DONE), 0);

        verify(taskRepo).findByStatusInOrderByUpdatedAtDesc(EnumSet.of(TaskStatus.DONE), PageRequest.of(0, 1));
    }

    // ------------------------------------------------------------------
    // External actors
    // ------------------------------------------------------------------

    @Test
    void create_startsAsNewWithTagsAndMetadata() {
        when(taskRepo.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));

        Task created = store.create("Book flights", "For the offsite", List.of("travel"), Map.of("people", "ops"));

        assertThat(created.getStatus()).isEqualTo(TaskStatus.NEW);
        assertThat(created.getTags()).containsExactly("travel");
        assertThat(created.getMetadata()).containsEntry("people", "ops");
    }

    @Test
    void recordHumanResponse_addsCommentAndMovesToUserInput() {
        Task task = TestTasks.task("t", TaskStatus.NEEDS_REVIEW);
        when(taskRepo.findWithCommentsById(task.getId())).thenReturn(Optional.of(task));
        when(taskRepo.save(task)).thenReturn(task);

        store.recordHumanResponse(task.getId(), "erin", "approve");

        assertThat(task.getStatus()).isEqualTo(TaskStatus.USER_INPUT_RECEIVED);
        assertThat(task.getComments()).extracting(c -> c.getContent()).containsExactly("approve");
    }

    @Test
    void recordHumanResponse_rejectedUnlessAwaitingReview() {
        Task task = TestTasks.task("t", TaskStatus.IN_PROGRESS);
        when(taskRepo.findWithCommentsById(task.getId())).thenReturn(Optional.of(task));

        assertThatThrownBy(() -> store.recordHumanResponse(task.getId(), "erin", "approve"))
                .isInstanceOf(IllegalTaskTransitionException.class);

        assertThat(task.getComments()).isEmpty();
        verify(taskRepo, never()).save(any());
    }

    @Test
    void cancel_terminalTask_isRejected() {
        Task task = TestTasks.task("t", TaskStatus.DONE);
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        assertThatThrownBy(() -> store.cancel(task.getId()))
                .isInstanceOf(IllegalTaskTransitionException.class);
    }

    @Test
    void cancel_openTask_isCancelled() {
        Task task = TestTasks.task("t", TaskStatus.WAITING);
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));
        ArgumentCaptor<Task> saved = ArgumentCaptor.forClass(Task.class);
        when(taskRepo.save(saved.capture())).thenReturn(task);

        store.cancel(task.getId());

        assertThat(saved.getValue().getStatus()).isEqualTo(TaskStatus.CANCELLED);
    }
}
