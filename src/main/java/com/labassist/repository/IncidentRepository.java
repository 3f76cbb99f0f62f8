package com.labassist.repository;

import com.labassist.entity.Incident;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Repository interface for managing {@link Incident} entities.
 */
public interface IncidentRepository extends JpaRepository<Incident, String> {

    /**
     * Case-insensitive substring match over title, description and resolution.
     *
     * @param pattern lowercase LIKE pattern, already wrapped in {@code %}, with {@code !} as escape character
     */
    @Query("SELECT i FROM Incident i WHERE lower(i.title) LIKE :pattern ESCAPE '!' "
            + "OR lower(i.description) LIKE :pattern ESCAPE '!' OR lower(i.resolution) LIKE :pattern ESCAPE '!'")
    List<Incident> searchByPattern(@Param("pattern") String pattern);
}
