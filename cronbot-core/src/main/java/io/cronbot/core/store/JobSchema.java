package io.cronbot.core.store;

import java.io.IOException;
import java.util.List;

final class JobSchema {
    private static final List<String> STATEMENTS = List.of(
        """
        CREATE TABLE IF NOT EXISTS jobs (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            name TEXT NOT NULL UNIQUE,
            description TEXT NOT NULL DEFAULT '',
            kind TEXT NOT NULL,
            schedule TEXT NOT NULL,
            target_collaborator TEXT NOT NULL,
            target_capability TEXT NOT NULL,
            parameters_json TEXT,
            parameters_version INTEGER NOT NULL DEFAULT 1,
            enabled INTEGER NOT NULL DEFAULT 1,
            last_run INTEGER,
            next_run INTEGER,
            run_count INTEGER NOT NULL DEFAULT 0,
            error_count INTEGER NOT NULL DEFAULT 0,
            last_error TEXT,
            created_at INTEGER NOT NULL,
            updated_at INTEGER NOT NULL
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_jobs_enabled ON jobs(enabled)",
        "CREATE INDEX IF NOT EXISTS idx_jobs_next_run ON jobs(next_run)",
        """
        CREATE TABLE IF NOT EXISTS execution_logs (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            job_id INTEGER NOT NULL REFERENCES jobs(id) ON DELETE CASCADE,
            executed_at INTEGER NOT NULL,
            status TEXT NOT NULL CHECK (status IN ('SUCCESS', 'ERROR', 'TIMEOUT')),
            duration_ms INTEGER NOT NULL DEFAULT 0,
            output_json TEXT,
            error_message TEXT
        )
        """,
        "CREATE INDEX IF NOT EXISTS idx_execution_logs_job_id ON execution_logs(job_id)",
        "CREATE INDEX IF NOT EXISTS idx_execution_logs_executed_at ON execution_logs(executed_at DESC)",
        "CREATE INDEX IF NOT EXISTS idx_execution_logs_status ON execution_logs(status)"
    );

    private JobSchema() {
    }

    static void apply(SqlExecutor executor) throws IOException {
        executor.inTransaction(tx -> {
            for (String statement : STATEMENTS) {
                tx.execute(statement);
            }
            return null;
        });
    }
}
