/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.puzzle.game;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static us.blanshard.puzzle.core.TestHelper.pair;
import static us.blanshard.puzzle.core.TestHelper.triangle;

import us.blanshard.puzzle.core.Puzzle;
import us.blanshard.puzzle.engine.Feasibility;
import us.blanshard.puzzle.engine.FeasibilityChecker;

import com.google.common.util.concurrent.MoreExecutors;

import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentMatcher;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class BackgroundFeasibilityTest {
  private static final long WAIT_MS = 10000;

  @Mock ValidationSession.Listener listener;
  @Mock FeasibilityWorker.Callback callback;
  ValidationSession session;
  FeasibilityWorker worker;

  @After public void tearDown() {
    if (session != null) session.close();
    if (worker != null) worker.close();
  }

  private static ArgumentMatcher<SessionStatus> hasState(final SessionStatus.State state) {
    return new ArgumentMatcher<SessionStatus>() {
      @Override public boolean matches(SessionStatus status) {
        return status != null && status.state == state && !status.caveat;
      }
    };
  }

  @Test public void editReturnsBeforeSearch() {
    session = ValidationSession.open(
        triangle(), ValidationSession.Options.DEFAULT.withBackground(true));
    session.addListener(listener);

    SessionStatus status = session.evaluate();
    assertEquals(SessionStatus.State.IN_PROGRESS, status.state);
    assertTrue(status.caveat);

    verify(listener, timeout(WAIT_MS)).statusChanged(
        same(session), argThat(hasState(SessionStatus.State.INFEASIBLE)));
    assertEquals(SessionStatus.State.INFEASIBLE, session.getStatus().state);
    assertEquals(1, session.getStatus().generation);
  }

  @Test public void contradictionsStaySynchronous() {
    session = ValidationSession.open(
        pair(1, 2), ValidationSession.Options.DEFAULT.withBackground(true));
    session.edit("a", 1);
    SessionStatus status = session.edit("b", 1);
    assertEquals(SessionStatus.State.VIOLATED, status.state);
    assertFalse(status.caveat);
  }

  @Test public void staleResultsDiscarded() {
    Puzzle triangle = triangle();
    FeasibilityChecker.Result infeasible =
        new FeasibilityChecker(triangle).check(triangle.getStartingDomains());
    assertEquals(Feasibility.INFEASIBLE, infeasible.feasibility);

    session = ValidationSession.open(pair(1, 2, 3));
    session.edit("a", 1);
    session.edit("a", 2);
    SessionStatus current = session.getStatus();

    session.backgroundResult(1, infeasible);
    assertEquals(current, session.getStatus());

    session.backgroundResult(2, infeasible);
    assertEquals(SessionStatus.State.INFEASIBLE, session.getStatus().state);
    assertEquals(2, session.getStatus().generation);
  }

  @Test public void workerDeliversLatest() {
    Puzzle puzzle = triangle();
    worker = new FeasibilityWorker(new FeasibilityChecker(puzzle), MoreExecutors.directExecutor());
    worker.submit(puzzle.getStartingDomains(), 1, callback);
    worker.submit(puzzle.getStartingDomains(), 2, callback);
    worker.submit(puzzle.getStartingDomains(), 3, callback);
    verify(callback, timeout(WAIT_MS)).onResult(eq(3L), any(FeasibilityChecker.Result.class));
  }

  @Test(expected = IllegalStateException.class)
  public void closedWorkerRefusesWork() {
    Puzzle puzzle = triangle();
    worker = new FeasibilityWorker(new FeasibilityChecker(puzzle), MoreExecutors.directExecutor());
    worker.close();
    worker.submit(puzzle.getStartingDomains(), 1, callback);
  }
}
