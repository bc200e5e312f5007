package com.artinerary.domain.mapper;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

/**
 * Existence lookups against tables owned by the account and art-catalog modules.
 */
public interface DirectoryMapper {

    @Select("""
            <script>
            select id
            from t_user
            where id in
            <foreach collection="ids" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            </script>
            """)
    List<Long> selectExistingUserIds(@Param("ids") Collection<Long> ids);

    @Select("""
            <script>
            select id
            from t_art_location
            where id in
            <foreach collection="ids" item="id" open="(" separator="," close=")">
              #{id}
            </foreach>
            </script>
            """)
    List<Long> selectExistingLocationIds(@Param("ids") Collection<Long> ids);
}
