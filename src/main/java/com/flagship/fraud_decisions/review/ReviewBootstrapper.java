package com.flagship.fraud_decisions.review;

import com.flagship.fraud_decisions.transaction.SurrogateIds;
import com.flagship.fraud_decisions.transaction.TransactionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Creates the review for a newly stored event.
 *
 * Joins the caller's transaction: the review becomes visible together with its event or not
 * at all. Only called for first-time inserts, so analyst work on an existing review is never
 * touched by a redelivery.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewBootstrapper {

    private final ReviewRepository reviewRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public UUID bootstrap(TransactionRecord record) {
        int priority = ReviewPriority.forEvent(record.getRiskLevel(), record.getDecision());
        ReviewEntity review = ReviewEntity.pending(SurrogateIds.newId(), record.getId(), priority);
        reviewRepository.save(review);

        log.debug("Review created: reviewId={}, transactionId={}, evaluationType={}, priority={}",
                review.getId(), record.getTransactionId(), record.getEvaluationType(), priority);
        return review.getId();
    }
}
