package com.starscape.mediareaper.features.media.infra;

import com.starscape.mediareaper.features.media.domain.Media;
import com.starscape.mediareaper.features.media.domain.MediaCatalog;
import com.starscape.mediareaper.features.media.domain.MediaType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface JpaMediaRepository extends JpaRepository<Media, Long>, MediaCatalog {
    
    @Override
    Optional<Media> findById(Long id);
    
    @Query("SELECT m FROM Media m WHERE m.protectedItem = false")
    List<Media> findAllUnprotected();
    
    @Query("SELECT m FROM Media m WHERE m.protectedItem = false AND m.type IN :types")
    List<Media> findUnprotectedByTypeIn(@Param("types") Collection<MediaType> types);
    
    @Override
    default List<Media> findCandidates(Collection<MediaType> types) {
        if (types == null || types.isEmpty()) {
            return findAllUnprotected();
        }
        return findUnprotectedByTypeIn(types);
    }
}
