package com.foursite.growth.repository;

import com.foursite.growth.entity.ShowcaseEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ShowcaseEntryRepository extends JpaRepository<ShowcaseEntry, UUID> {

    List<ShowcaseEntry> findByShowcaseRankBetweenOrderByShowcaseRankAsc(int fromRank, int toRank);
}
