// file: server/src/main/java/io/fanlite/server/dto/TestCallResponse.java
package io.fanlite.server.dto;

import java.util.List;

/**
 * JSON body returned by GET /debug/testcall/{command}.
 */
public class TestCallResponse {
    public String command;
    public List<String> lines;
}
