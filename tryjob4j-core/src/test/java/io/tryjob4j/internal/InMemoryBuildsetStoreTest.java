package io.tryjob4j.internal;

import io.tryjob4j.BuildStatusFeed;
import io.tryjob4j.core.BuildCompletion;
import io.tryjob4j.core.BuildResult;
import io.tryjob4j.core.BuildsetRequest;
import io.tryjob4j.core.SourceStamp;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryBuildsetStoreTest {

    private final InMemoryBuildsetStore store = new InMemoryBuildsetStore();

    @Test
    void createBuildsetShouldAssignDistinctIds() {
        String first = store.createBuildset(request());
        String second = store.createBuildset(request());

        assertEquals(2, store.getBuildsets().size());
        assertTrue(!first.equals(second));
        assertEquals(List.of("a", "b"), store.getBuildset(first).orElseThrow().builderNames());
    }

    @Test
    void subscribeShouldReplayKnownResultsThenPushNewOnes() {
        String id = store.createBuildset(request());
        BuildCompletion a = new BuildCompletion("a", 1, BuildResult.SUCCESS, "finished");
        BuildCompletion b = new BuildCompletion("b", 1, BuildResult.FAILURE, "failed compile");
        store.recordCompletion(id, a);

        List<BuildCompletion> received = new ArrayList<>();
        BuildStatusFeed.Subscription sub = store.subscribe(id, received::add);
        store.recordCompletion(id, b);
        sub.cancel();
        store.recordCompletion(id, new BuildCompletion("c", 1, BuildResult.SUCCESS, null));

        assertEquals(List.of(a, b), received);
        assertEquals(3, store.getCompletions(id).size());
    }

    @Test
    void unknownBuildsetsAreRejected() {
        BuildCompletion c = new BuildCompletion("a", 1, BuildResult.SUCCESS, null);
        assertThrows(IllegalArgumentException.class, () -> store.recordCompletion("bs-404", c));
        assertThrows(IllegalArgumentException.class, () -> store.subscribe("bs-404", x -> { }));
    }

    @Test
    void creationHookSeesEveryBuildset() {
        List<String> seen = new ArrayList<>();
        store.onBuildsetCreated(bs -> seen.add(bs.id()));

        String id = store.createBuildset(request());

        assertEquals(List.of(id), seen);
    }

    private static BuildsetRequest request() {
        return new BuildsetRequest("try", SourceStamp.of("trunk", "r1", null), List.of("a", "b"),
                "'try' job", null, null, "job-1", null);
    }
}
