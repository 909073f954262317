package com.pennywise_sync.repository;

import com.pennywise_sync.model.Category;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface CategoryRepository extends ReactiveCrudRepository<Category, Long> {
    Mono<Category> findByName(String name);
    Flux<Category> findAllByOrderByDisplayOrderAscNameAsc();
}
