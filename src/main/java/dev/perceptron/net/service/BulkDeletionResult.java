package dev.perceptron.net.service;

/**
 * Outcome of deleting every known network.
 *
 * @param deletedCount      distinct network ids processed
 * @param deletedFromMemory how many were in memory
 * @param deletedFromDisk   how many had a saved file
 */
public record BulkDeletionResult(int deletedCount, int deletedFromMemory, int deletedFromDisk) {

    public String message() {
        return "Successfully deleted " + deletedCount + " network(s)";
    }
}
