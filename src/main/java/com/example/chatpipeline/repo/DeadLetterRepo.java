package com.example.chatpipeline.repo;

import com.example.chatpipeline.model.DeadLetterBatch;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DeadLetterRepo extends MongoRepository<DeadLetterBatch, String> {
    List<DeadLetterBatch> findTop50ByReplayedFalseOrderByFailedAtAsc();
    long countByReplayedFalse();
}
