package uk.gegc.quizforge.features.job.application;

public record JobStats(long total, long pending, long running, long completed, long failed, long cancelled) {
}
