/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
import oracle.docstore.driver.DocStoreConfig;
import oracle.docstore.driver.DocStoreHandle;
import oracle.docstore.driver.DocStoreHandleFactory;

/*
 * Common is a companion class to the document store examples. It parses
 * the arguments shared by the examples and creates the handle.
 *
 * The arguments are:
 *   java Example <endpoint> <project> [-database <database>]
 *
 * For example, against a local emulator listening on port 8080:
 *   java -cp .:../lib/docstore-java-sdk.jar HelloWorld \
 *                http://localhost:8080 demo-project
 */
class Common {

    private static final String DATABASE_FLAG = "-database";

    private final String exampleName;
    private String endpoint;
    private String projectId;
    private String databaseId;

    Common(String exampleName) {
        this.exampleName = exampleName;
    }

    /**
     * Parses the arguments, exiting with a usage message if they are
     * invalid.
     */
    void parseArgs(String[] args) {
        if (args.length < 2) {
            usage(null);
        }
        endpoint = args[0];
        projectId = args[1];
        for (int i = 2; i < args.length; i++) {
            String arg = args[i];
            if (DATABASE_FLAG.equals(arg)) {
                if (++i >= args.length) {
                    usage("Flag " + arg + " requires an argument");
                }
                databaseId = args[i];
            } else {
                usage("Unknown argument: " + arg);
            }
        }
    }

    /**
     * Creates the handle. The caller must close it.
     */
    DocStoreHandle getHandle() {
        DocStoreConfig config = new DocStoreConfig(endpoint)
            .setProjectId(projectId);
        if (databaseId != null) {
            config.setDatabaseId(databaseId);
        }
        System.out.println("Using endpoint " + config.getServiceURL() +
                           ", project " + projectId);
        return DocStoreHandleFactory.createHandle(config);
    }

    private void usage(String message) {
        if (message != null) {
            System.err.println("\n" + message + "\n");
        }
        System.err.println("Usage: java -cp .:docstore-java-sdk.jar " +
                           exampleName + " <endpoint> <project>" +
                           " [" + DATABASE_FLAG + " <database>]");
        System.exit(1);
    }
}
