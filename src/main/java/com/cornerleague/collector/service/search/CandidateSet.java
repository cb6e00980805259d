package com.cornerleague.collector.service.search;

import java.util.List;

public record CandidateSet(List<IndexedDocument> documents, CorpusStats stats) {}
