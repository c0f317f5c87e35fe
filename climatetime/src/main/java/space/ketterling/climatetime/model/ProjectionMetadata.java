package space.ketterling.climatetime.model;

/**
 * @param source      typed origin of the numbers in the response
 * @param dataSource  human readable provider description
 * @param lastUpdated ISO-8601 instant the projection was built
 */
public record ProjectionMetadata(
        DataSource source,
        String dataSource,
        String lastUpdated,
        String confidenceLevel) {
}
