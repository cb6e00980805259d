package com.cornerleague.collector.domain.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "search_postings", indexes = {
        @Index(name = "idx_search_postings_term", columnList = "term"),
        @Index(name = "idx_search_postings_url", columnList = "canonical_url")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchPosting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String term;

    @Column(name = "canonical_url", nullable = false, length = 2048)
    private String canonicalUrl;

    @Column(name = "term_frequency", nullable = false)
    private int termFrequency;
}
