package uk.gegc.quizforge.shared.exception;

import java.util.UUID;

public class JobNotFoundException extends JobException {

    public JobNotFoundException(UUID jobId) {
        super("Generation job " + jobId + " not found");
    }
}
