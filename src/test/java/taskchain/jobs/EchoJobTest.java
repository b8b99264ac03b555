package taskchain.jobs;

import taskchain.engine.job.JobOutput;
import taskchain.engine.model.TaskView;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EchoJobTest {

    @Test
    void returnsPayload() {
        JobOutput output = new EchoJob().run(new TaskView("t", "wf", 1, EchoJob.TASK_TYPE, "{\"a\":1}"));

        assertEquals(JobOutput.success("{\"a\":1}"), output);
    }
}
