package com.github.fsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.fsm.MachineDefinition.MachineDefinitionBuilder;
import com.github.fsm.StateMachine.StateMachineBuilder;
import com.github.fsm.StateMachineException.Code;
import com.github.fsm.TransitionHandlers.TransitionHandlersBuilder;
import com.github.fsm.TransitionTable.TransitionTableBuilder;

/**
 * Tests for an FSM tracking the publishing workflow of a news post, with handlers acting on the
 * bound post.
 *
 * @author gaurav
 */
public final class WorkflowStateMachineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger =
      LogManager.getLogger(WorkflowStateMachineTest.class.getSimpleName());

  // Post States:: DRAFT -> AWAITING_REVIEW -> REVIEWED -> PUBLISHED
  // with REJECTED reachable from everything but PUBLISHED and leading back to DRAFT
  static TransitionTable workflowTable() throws StateMachineException {
    return TransitionTableBuilder.newBuilder()
        .transitions("draft", "awaiting_review", "rejected")
        .transitions("awaiting_review", "draft", "reviewed", "rejected")
        .transitions("reviewed", "published", "rejected").terminal("published")
        .transitions("rejected", "draft").build();
  }

  static TransitionHandlers<NewsPost> workflowHandlers() throws StateMachineException {
    return TransitionHandlersBuilder.<NewsPost>newBuilder().onAnyTransition((machine, nextState) -> {
      final NewsPost post = machine.getSubject().get();
      post.state = nextState;
      post.save();
    }).onTransitionTo("awaiting_review", (machine, nextState) -> {
      final NewsPost post = machine.getSubject().get();
      post.notifications.add(post.title + " ready for review");
    }).onTransitionTo("published", (machine, nextState) -> {
      final NewsPost post = machine.getSubject().get();
      post.publishedAt = Instant.now();
      post.save();
    }).build();
  }

  @Test
  public void testPostFlow() throws StateMachineException {
    final MachineDefinition<NewsPost> definition = MachineDefinitionBuilder.<NewsPost>newBuilder()
        .name("news-workflow").transitions(workflowTable()).defaultState("draft")
        .handlers(workflowHandlers()).build();
    final NewsPost post = new NewsPost("Hello world!", "draft");
    final StateMachine<NewsPost> machine =
        StateMachineBuilder.newBuilder(definition).subject(post).build();
    assertSame(post, machine.getSubject().get());
    assertEquals("draft", machine.readCurrentState());

    // draft->awaiting_review
    machine.transitionTo("awaiting_review");
    assertEquals("awaiting_review", post.state);
    assertNull(post.publishedAt);
    assertEquals(1, post.notifications.size());

    // awaiting_review->reviewed
    machine.transitionTo("reviewed");
    assertEquals("reviewed", post.state);
    assertNull(post.publishedAt);
    assertTrue(machine.isAllowed("published"));

    // reviewed->awaiting_review is not allowed
    try {
      machine.transitionTo("awaiting_review");
      fail("reviewed->awaiting_review is not in the table");
    } catch (StateMachineException expected) {
      assertEquals(Code.TRANSITION_NOT_ALLOWED, expected.getCode());
      assertEquals("reviewed", expected.getFromState());
      assertEquals("awaiting_review", expected.getToState());
      assertTrue(expected.getMessage()
          .contains("'reviewed' cannot transition to 'awaiting_review'"));
    }
    assertEquals("reviewed", machine.readCurrentState());
    assertEquals("reviewed", post.state);

    // reviewed->published, both the wildcard and the published handler run
    machine.transitionTo("published");
    assertEquals("published", post.state);
    assertNotNull(post.publishedAt);
    assertEquals("published", machine.readCurrentState());
    // 3 from the wildcard handler, 1 from the published handler
    assertEquals(4, post.saves);

    try {
      machine.transitionTo("draft");
      fail("published is terminal");
    } catch (StateMachineException expected) {
      assertEquals(Code.TRANSITION_NOT_ALLOWED, expected.getCode());
    }
    logger.info(machine.getStatistics());
  }

  @Test
  public void testRejectionLoop() throws StateMachineException {
    final MachineDefinition<NewsPost> definition = MachineDefinitionBuilder.<NewsPost>newBuilder()
        .transitions(workflowTable()).defaultState("draft").handlers(workflowHandlers()).build();
    final NewsPost post = new NewsPost("Loop", "awaiting_review");
    final StateMachine<NewsPost> machine = StateMachineBuilder.newBuilder(definition)
        .subject(post).initialState("awaiting_review").build();

    machine.transitionTo("rejected");
    machine.transitionTo("draft");
    machine.transitionTo("awaiting_review");
    assertEquals("awaiting_review", post.state);
    assertEquals(1, post.notifications.size());
    assertEquals(3, machine.getStatistics().getTransitionSuccesses());
  }

  @Test
  public void testLoadedDefinitionDrivesSubject() throws StateMachineException {
    final MachineDefinition<NewsPost> definition = new MachineDefinitionLoader()
        .loadResource(null, "definitions/news-workflow.json", workflowHandlers());
    assertEquals("news-workflow", definition.getName());
    assertEquals(workflowTable(), definition.getTransitionTable());

    final NewsPost post = new NewsPost("Loaded", "draft");
    final StateMachine<NewsPost> machine =
        StateMachineBuilder.newBuilder(definition).subject(post).build();
    machine.transitionTo("awaiting_review");
    machine.transitionTo("reviewed");
    machine.transitionTo("published");
    assertEquals("published", post.state);
    assertNotNull(post.publishedAt);
  }

  static final class NewsPost {
    final String title;
    String state;
    Instant publishedAt;
    int saves;
    final List<String> notifications = new ArrayList<>();

    NewsPost(final String title, final String state) {
      this.title = title;
      this.state = state;
    }

    // would persist to a store
    void save() {
      saves++;
    }
  }

}
