// file: src/main/java/io/graphvault/server/dto/RestoreRequest.java
package io.graphvault.server.dto;

import java.util.List;

/**
 * Body of POST /restore and POST /restore/selective.
 * Example:
 *   {
 *     "snapshotId": "20250623_190459_000",
 *     "preserveLabels": ["User"]
 *   }
 * A missing snapshotId means the latest snapshot; preserveLabels is ignored by a full restore.
 */
public class RestoreRequest {
    public String snapshotId;
    public List<String> preserveLabels;
}
