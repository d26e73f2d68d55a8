package com.example.summarizer.summary;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TextSummaryRepository extends JpaRepository<TextSummary, Long> {
    List<TextSummary> findByUrl(String url);
}
