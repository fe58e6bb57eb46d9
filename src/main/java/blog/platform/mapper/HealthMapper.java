package blog.platform.mapper;

import org.apache.ibatis.annotations.Mapper;

/**
 * Database liveness probe
 */
@Mapper
public interface HealthMapper {
    int ping();
}
