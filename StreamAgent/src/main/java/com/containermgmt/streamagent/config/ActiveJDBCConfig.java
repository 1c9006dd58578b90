package com.containermgmt.streamagent.config;

import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * ActiveJDBC connection management on top of the pooled DataSource.
 *
 * ActiveJDBC binds connections to the calling thread, so the apply worker
 * borrows one per batch and hands it back when the batch is settled.
 */
@Configuration
@Slf4j
public class ActiveJDBCConfig {

    private final DataSource dataSource;

    public ActiveJDBCConfig(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Opens a connection for the current thread.
     *
     * @return true if this call opened it, false if the thread already had one
     */
    public boolean openConnection() {
        if (Base.hasConnection()) {
            return false;
        }
        Base.open(dataSource);
        log.trace("ActiveJDBC connection borrowed from pool");
        return true;
    }

    /**
     * Returns the current thread's connection to the pool.
     */
    public void closeConnection() {
        if (Base.hasConnection()) {
            Base.close();
            log.trace("ActiveJDBC connection returned to pool");
        }
    }
}
