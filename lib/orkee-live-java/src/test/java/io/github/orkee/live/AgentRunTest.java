package io.github.orkee.live;

import com.google.gson.Gson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AgentRunTest {

    @Test
    void constructorAndGetters() {
        AgentRun run = new AgentRun("run-1", "proj-1", "failed", 4, 10, 6, 3, 1.75, "budget exceeded");

        assertThat(run.getId()).isEqualTo("run-1");
        assertThat(run.getProjectId()).isEqualTo("proj-1");
        assertThat(run.getStatus()).isEqualTo("failed");
        assertThat(run.getCurrentIteration()).isEqualTo(4);
        assertThat(run.getMaxIterations()).isEqualTo(10);
        assertThat(run.getStoriesTotal()).isEqualTo(6);
        assertThat(run.getStoriesCompleted()).isEqualTo(3);
        assertThat(run.getTotalCost()).isEqualTo(1.75);
        assertThat(run.getError()).isEqualTo("budget exceeded");
        assertThat(run.isTerminal()).isTrue();
    }

    @Test
    void pendingAndRunningAreNotTerminal() {
        assertThat(new AgentRun("r", "p", "pending", 0, 1, 0, 0, 0, null).isTerminal()).isFalse();
        assertThat(new AgentRun("r", "p", "running", 0, 1, 0, 0, 0, null).isTerminal()).isFalse();
        assertThat(new AgentRun("r", "p", null, 0, 1, 0, 0, 0, null).isTerminal()).isFalse();
    }

    @Test
    void decodesSnakeCaseJson() {
        AgentRun run = new Gson().fromJson("{\"id\":\"r9\",\"project_id\":\"p\",\"status\":\"completed\","
                + "\"current_iteration\":5,\"max_iterations\":5,\"stories_total\":2,\"stories_completed\":2,"
                + "\"total_cost\":0.5,\"unknown_field\":true}", AgentRun.class);

        assertThat(run).isEqualTo(new AgentRun("r9", "p", "completed", 5, 5, 2, 2, 0.5, null));
    }

    @Test
    void equalsAndHashCode() {
        AgentRun run1 = new AgentRun("r", "p", "running", 1, 2, 3, 4, 0.1, null);
        AgentRun run2 = new AgentRun("r", "p", "running", 1, 2, 3, 4, 0.1, null);
        AgentRun run3 = new AgentRun("r", "p", "completed", 1, 2, 3, 4, 0.1, null);

        assertThat(run1).isEqualTo(run2);
        assertThat(run1.hashCode()).isEqualTo(run2.hashCode());
        assertThat(run1).isNotEqualTo(run3);
    }

    @Test
    void toStringContainsProgress() {
        String str = new AgentRun("r1", "p", "running", 2, 8, 5, 1, 0, null).toString();

        assertThat(str).contains("id='r1'");
        assertThat(str).contains("status='running'");
        assertThat(str).contains("iteration=2/8");
        assertThat(str).contains("stories=1/5");
    }

    @Test
    void serverListHandlesMissingServers() {
        ServerList list = new Gson().fromJson("{}", ServerList.class);

        assertThat(list.getServers()).isEmpty();
        assertThat(list.getProjectIds()).isEmpty();
        assertThat(new ServerList(null)).isEqualTo(new ServerList(List.of()));
    }
}
