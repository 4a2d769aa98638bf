package com.example.dispatcher.domain;

import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

@Entity
@Getter @Setter @ToString
@Table(name = "scheduled_job", indexes = {@Index(name = "idx_job_enabled", columnList = "enabled, priority, id"), @Index(name = "idx_job_locked", columnList = "locked, last_execution")})
public class ScheduledJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 150)
    private String name;

    @Column(name = "command_name", nullable = false, length = 200)
    private String commandName;

    @Column(name = "arguments", length = 2000)
    private String arguments;

    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(name = "last_execution", columnDefinition = "TIMESTAMP(3)")
    private Timestamp lastExecution;

    @Column(name = "last_return_code")
    private Integer lastReturnCode;

    @Column(name = "log_file", length = 255)
    private String logFile;

    @Column(name = "priority", nullable = false)
    private Integer priority = 0;

    @Column(name = "execute_immediately", nullable = false)
    private boolean executeImmediately;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @Column(name = "locked", nullable = false)
    private boolean locked;
}
