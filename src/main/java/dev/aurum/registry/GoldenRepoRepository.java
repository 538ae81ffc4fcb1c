package dev.aurum.registry;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

/** Spring Data repository for {@link GoldenRepo} entities. */
public interface GoldenRepoRepository extends JpaRepository<GoldenRepo, UUID> {

  Optional<GoldenRepo> findByAlias(String alias);

  boolean existsByAlias(String alias);

  /**
   * Returns every registered alias in alphabetical order.
   *
   * @return aliases, empty if nothing is registered
   */
  @Query("SELECT g.alias FROM GoldenRepo g ORDER BY g.alias")
  List<String> findAllAliases();
}
