package personal.bistro.booking.settings.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Restaurant Settings
 */
public interface JpaSettingsRepository extends JpaRepository<SettingsEntity, Long> {
}
