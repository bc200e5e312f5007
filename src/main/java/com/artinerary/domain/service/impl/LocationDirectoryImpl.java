package com.artinerary.domain.service.impl;

import com.artinerary.domain.mapper.DirectoryMapper;
import com.artinerary.domain.service.LocationDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class LocationDirectoryImpl implements LocationDirectory {

    private final DirectoryMapper directoryMapper;

    @Override
    public Set<Long> existingIds(Collection<Long> locationIds) {
        Set<Long> ids = new LinkedHashSet<>();
        if (locationIds != null) {
            for (Long id : locationIds) {
                if (id != null && id > 0) {
                    ids.add(id);
                }
            }
        }
        if (ids.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(directoryMapper.selectExistingLocationIds(ids));
    }
}
