package com.example.chatpipeline.repo;

import com.example.chatpipeline.model.DispatchCursor;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DispatchCursorRepo extends MongoRepository<DispatchCursor, String> {}
