package io.snapshots.jobs;

import java.util.Map;

/**
 * Renders crontab lines that invoke the job launcher, one per registered job.
 */
public class CrontabRenderer {
    private final String launcher;
    private final String logFile;

    /**
     * @param launcher command prefix that accepts {@code run <job>}, e.g. {@code cd /opt/snapshots && java -jar snapshots.jar}
     * @param logFile  file both output streams are appended to
     */
    public CrontabRenderer(String launcher, String logFile) {
        this.launcher = launcher;
        this.logFile = logFile;
    }

    public String line(JobDescriptor job) {
        return job.schedule() + " " + launcher + " run " + job.name() + " >> " + logFile + " 2>&1";
    }

    public String render(Map<String, JobDescriptor> jobs) {
        StringBuilder sb = new StringBuilder("# snapshot pipelines\n");
        for (JobDescriptor d : jobs.values()) {
            if (d.description() != null && !d.description().isBlank()) sb.append("# ").append(d.description()).append('\n');
            sb.append(line(d)).append('\n');
        }
        return sb.toString();
    }
}
