package shorted.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;

import shorted.core.model.shorts.AboutStatistics;
import shorted.core.model.shorts.DashboardParameters;
import shorted.core.port.in.DashboardQueries;

/**
 * Cached dashboard data: top shorts, the industry treemap, stock tooltips and about-page figures.
 *
 * <p>All paths sit under the {@code api} route class. Parameters outside
 * {@link DashboardParameters} are rejected with 400.
 */
@Path("/api")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ShortsResource {

    private final DashboardQueries queries;

    @Inject
    public ShortsResource(DashboardQueries queries) {
        this.queries = queries;
    }

    @GET
    @Path("/shorts/top")
    public Uni<JsonNode> topShorts(
            @QueryParam("period") @DefaultValue("3m") String period,
            @QueryParam("limit") @DefaultValue("50") int limit,
            @QueryParam("offset") @DefaultValue("0") int offset) {
        return queries.topShorts(
                DashboardParameters.requirePeriod(period),
                DashboardParameters.requireLimit(limit),
                DashboardParameters.requireOffset(offset));
    }

    @GET
    @Path("/shorts/treemap")
    public Uni<JsonNode> treeMap(
            @QueryParam("period") @DefaultValue("3m") String period,
            @QueryParam("limit") @DefaultValue("10") int limit,
            @QueryParam("viewMode") @DefaultValue("CURRENT_CHANGE") String viewMode) {
        return queries.treeMap(
                DashboardParameters.requirePeriod(period),
                DashboardParameters.requireLimit(limit),
                DashboardParameters.requireViewMode(viewMode));
    }

    @GET
    @Path("/stocks/{code}/tooltip")
    public Uni<JsonNode> stockTooltip(@PathParam("code") String code) {
        return queries.stockTooltip(DashboardParameters.requireProductCode(code));
    }

    @GET
    @Path("/about/statistics")
    public Uni<AboutStatistics> aboutStatistics() {
        return queries.aboutStatistics();
    }

    @GET
    @Path("/about/top-stocks")
    public Uni<JsonNode> aboutTopStocks(@QueryParam("limit") @DefaultValue("5") int limit) {
        return queries.aboutTopStocks(DashboardParameters.requireLimit(limit));
    }
}
