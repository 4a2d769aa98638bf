package com.example.dispatcher.service;

import com.example.dispatcher.domain.DispatchOptions;
import com.example.dispatcher.domain.DispatchReport;
import com.example.dispatcher.domain.JobOutcome;
import com.example.dispatcher.domain.ScheduledJob;
import com.example.dispatcher.repo.ScheduledJobRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.sql.Timestamp;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class CommandDispatcherIntegrationTest {

    @Autowired
    private CommandDispatcher dispatcher;

    @Autowired
    private ScheduledJobRepo repo;

    @BeforeEach
    void clean() {
        repo.deleteAll();
    }

    @Test
    void passRunsDueJobsThroughTheDatabase() {
        ScheduledJob mapped = job("greeting", "greet", null);
        mapped.setExecuteImmediately(true);
        mapped.setCronExpression("0 0 1 1 *");
        mapped.setLastExecution(Timestamp.from(Instant.now()));
        mapped = repo.save(mapped);
        ScheduledJob failing = job("failing", "sh", "-c \"exit 5\"");
        failing.setLastExecution(Timestamp.from(Instant.now().minusSeconds(120)));
        failing = repo.save(failing);
        ScheduledJob locked = job("busy", "sh", "-c \"exit 0\"");
        locked.setLocked(true);
        locked.setLastExecution(Timestamp.from(Instant.now().minusSeconds(120)));
        locked = repo.save(locked);

        DispatchReport report = dispatcher.dispatch(DispatchOptions.builder().noOutput(true).build());

        assertThat(report.outcomeOf(mapped.getId())).hasValueSatisfying(o -> assertThat(o.getStatus()).isEqualTo(JobOutcome.Status.SUCCEEDED));
        assertThat(report.outcomeOf(failing.getId())).hasValueSatisfying(o -> assertThat(o.getReturnCode()).isEqualTo(5));
        assertThat(report.outcomeOf(locked.getId())).hasValueSatisfying(o -> assertThat(o.getStatus()).isEqualTo(JobOutcome.Status.LOCKED));

        ScheduledJob m = repo.findById(mapped.getId()).orElseThrow(AssertionError::new);
        assertThat(m.getLastReturnCode()).isZero();
        assertThat(m.isLocked()).isFalse();
        assertThat(m.isExecuteImmediately()).isFalse();

        ScheduledJob f = repo.findById(failing.getId()).orElseThrow(AssertionError::new);
        assertThat(f.getLastReturnCode()).isEqualTo(5);
        assertThat(f.isLocked()).isFalse();
        assertThat(f.getLastExecution()).isNotNull();

        assertThat(repo.findById(locked.getId())).hasValueSatisfying(j -> assertThat(j.isLocked()).isTrue());

        DispatchReport second = dispatcher.dispatch(DispatchOptions.builder().noOutput(true).unlockSeconds(60L).build());
        assertThat(second.getUnlocked()).isEqualTo(1);
        assertThat(second.outcomeOf(locked.getId())).hasValueSatisfying(o -> assertThat(o.getStatus()).isEqualTo(JobOutcome.Status.SUCCEEDED));
        assertThat(second.outcomeOf(mapped.getId())).isEmpty();
    }

    private static ScheduledJob job(String name, String command, String arguments) {
        ScheduledJob job = new ScheduledJob();
        job.setName(name);
        job.setCommandName(command);
        job.setArguments(arguments);
        job.setCronExpression("* * * * *");
        return job;
    }
}
