package shorted.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.smallrye.mutiny.Uni;

import shorted.core.model.shorts.DashboardParameters;
import shorted.core.port.in.DashboardQueries;

/**
 * Stock search by code or company name. Rate limited under the {@code search} route class.
 */
@Path("/api/search/stocks")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class SearchResource {

    private final DashboardQueries queries;

    @Inject
    public SearchResource(DashboardQueries queries) {
        this.queries = queries;
    }

    @GET
    public Uni<JsonNode> search(@QueryParam("q") String query, @QueryParam("limit") @DefaultValue("10") int limit) {
        if (query == null || query.isBlank()) {
            final var empty = JsonNodeFactory.instance.objectNode();
            empty.putArray("results");
            return Uni.createFrom().<JsonNode>item(empty);
        }
        return queries.searchStocks(
                DashboardParameters.requireSearchQuery(query), DashboardParameters.requireLimit(limit));
    }
}
