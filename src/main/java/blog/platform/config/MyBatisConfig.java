package blog.platform.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatis configuration class
 * Configures mapper scanning; statements live in classpath:mapper/*.xml
 */
@Configuration
@MapperScan("blog.platform.mapper")
public class MyBatisConfig {
}
