package com.umitunal;

import com.umitunal.jobmgr.JobManager;
import com.umitunal.jobmgr.cli.JobManagerCommand;
import com.umitunal.jobmgr.config.ManagerConfig;

/**
 * Command-line entry point of jobmgr.
 */
public class Main {
    public static void main(String[] args) {
        ManagerConfig config = ManagerConfig.fromEnvironment();
        // Logback reads the base directory from this property when the first logger is created
        System.setProperty(ManagerConfig.HOME_PROPERTY, config.getBaseDirectory().toString());

        int exitCode = JobManagerCommand
                .newCommandLine(() -> JobManager.create(config, Main.class.getName()))
                .execute(args);
        System.exit(exitCode);
    }
}
