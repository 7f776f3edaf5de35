package com.bit.governance.database;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "system.db")
public class DbConfig {
    private String type = "rocksdb";//存储类型 rocksdb / memory
    private String path;//保存路径

    @Autowired
    private DataBase dataBase;

    @PostConstruct
    public void init() {
        log.info("系统数据路径:{} 存储类型:{}", path, type);
        boolean database = dataBase.createDatabase(this);
        if (!database) {
            throw new IllegalStateException("数据库创建失败");
        }
        if (!dataBase.checkHealth()) {
            throw new IllegalStateException("数据库健康检查失败");
        }
        log.info("数据表: {}", dataBase.listAllTables());
    }

    @PreDestroy
    public void shutdown() {
        dataBase.closeDatabase();
    }
}
