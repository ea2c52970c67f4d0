package com.example.vulncases.access;

import com.example.vulncases.models.Platform;
import com.example.vulncases.models.TestCase;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the {@code test_cases} table, keyed by {@code vuln_id}. Implementations
 * must enforce uniqueness of the key in the store itself so concurrent writers cannot both win.
 */
public interface TestCaseAccess {

    /**
     * Inserts all test cases or none of them.
     *
     * @return number of test cases written
     * @throws DuplicateVulnIdException if any {@code vuln_id} already exists
     */
    int insertAll(List<TestCase> testCases);

    Optional<TestCase> findByVulnId(String vulnId);

    /**
     * @return every stored test case ordered by {@code vuln_id}
     */
    List<TestCase> findAll();

    /**
     * @return test cases whose canonical platform matches, ordered by {@code vuln_id}
     */
    List<TestCase> findByPlatform(Platform platform);

    /**
     * Writes every non-null attribute of {@code patch} onto the existing item with the same key.
     *
     * @return false if no item with that key exists; nothing is written in that case
     */
    boolean update(TestCase patch);

    /**
     * @return how many of the given keys existed and were deleted
     */
    int deleteAll(Collection<String> vulnIds);

    /**
     * Round-trips to the store; throws if it cannot be reached.
     */
    void ping();
}
