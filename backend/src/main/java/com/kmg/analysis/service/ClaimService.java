package com.kmg.analysis.service;

import com.kmg.analysis.model.RunItemRecord;
import com.kmg.analysis.repo.RunItemRepository;
import com.kmg.analysis.repo.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The only path that takes items out of the queue. A claim is one conditional update, so concurrent
 * callers never receive the same item; if the enclosing transaction rolls back the rows stay queued.
 */
@Service
public class ClaimService {
    private static final Logger log = LoggerFactory.getLogger(ClaimService.class);

    private final RunItemRepository runItemRepository;
    private final RunRepository runRepository;
    private final TransactionTemplate transactionTemplate;
    private final TimeService timeService;

    public ClaimService(
            RunItemRepository runItemRepository,
            RunRepository runRepository,
            TransactionTemplate transactionTemplate,
            TimeService timeService
    ) {
        this.runItemRepository = runItemRepository;
        this.runRepository = runRepository;
        this.transactionTemplate = transactionTemplate;
        this.timeService = timeService;
    }

    public List<RunItemRecord> claim(long runId, int batchSize, String workerId) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        String claimToken = UUID.randomUUID().toString();

        List<RunItemRecord> claimed = transactionTemplate.execute(status -> {
            Instant now = timeService.now();
            int count = runItemRepository.claim(runId, batchSize, workerId, claimToken, now);
            if (count == 0) {
                return List.<RunItemRecord>of();
            }
            if (runRepository.markRunning(runId, now)) {
                log.info("Run {} started by worker {}", runId, workerId);
            }
            return runItemRepository.findByClaimToken(claimToken);
        });

        if (claimed == null) {
            return List.of();
        }
        if (!claimed.isEmpty()) {
            log.debug("Worker {} claimed {} item(s) from run {}", workerId, claimed.size(), runId);
        }
        return claimed;
    }
}
