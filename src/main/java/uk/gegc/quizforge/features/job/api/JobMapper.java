package uk.gegc.quizforge.features.job.api;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.quizforge.features.job.api.dto.JobResponse;
import uk.gegc.quizforge.features.job.application.GenerationJobStore;
import uk.gegc.quizforge.features.job.domain.model.GenerationJob;

@Component
@RequiredArgsConstructor
public class JobMapper {

    private final GenerationJobStore jobStore;

    public JobResponse toResponse(GenerationJob job) {
        return new JobResponse(
                job.getId(),
                job.getStatus(),
                job.getProgress(),
                jobStore.readResult(job),
                job.getError(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }
}
