package com.climaterisklens.api;

import com.climaterisklens.assets.AssetFileParser.ParsedSite;
import com.climaterisklens.assets.AssetFileParser.ParsedUpload;
import com.climaterisklens.assets.InvalidUploadException;
import com.climaterisklens.db.SiteRepo.NewSite;
import com.climaterisklens.db.SiteRepo.Site;
import com.climaterisklens.db.UserRepo.User;
import com.climaterisklens.geo.GridSystem;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.UploadedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Site uploads (CSV or GeoJSON), site listing and per-site risk.
 */
final class ApiRoutesAssets {
    private static final Logger log = LoggerFactory.getLogger(ApiRoutesAssets.class);

    private ApiRoutesAssets() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppServices svc = api.svc();
        GridSystem grid = svc.risk().grid();

        app.post(ApiServer.API + "/assets/upload", ctx -> {
            User user = AuthGuard.requireUser(api, ctx);
            if (user.orgId() == null) {
                throw ApiException.badRequest("no_organization", "User must belong to an organization");
            }
            UploadedFile file = ctx.uploadedFile("file");
            if (file == null) {
                throw ApiException.badRequest("no_file", "No file provided");
            }
            byte[] content;
            try (InputStream in = file.content()) {
                content = in.readAllBytes();
            }

            ParsedUpload parsed;
            try {
                parsed = svc.assetParser().parse(file.filename(), content);
            } catch (InvalidUploadException e) {
                throw ApiException.badRequest(e.code(), e.getMessage());
            }

            List<NewSite> sites = new ArrayList<>(parsed.sites().size());
            for (ParsedSite s : parsed.sites()) {
                sites.add(new NewSite(s.name(), s.lat(), s.lon(), grid.pointToGridId(s.lat(), s.lon())));
            }
            String metadata = om.writeValueAsString(om.createObjectNode().put("source", parsed.source()));
            List<UUID> ids = svc.sites().insertAll(user.orgId(), sites, metadata);
            log.info("Uploaded {} sites ({}) for org {}", ids.size(), parsed.fileType(), user.orgId());

            ObjectNode out = om.createObjectNode();
            ArrayNode idArr = out.putArray("site_ids");
            ids.forEach(id -> idArr.add(id.toString()));
            out.putObject("stats").put("total_sites", ids.size()).put("file_type", parsed.fileType());
            ctx.json(out);
        });

        app.get(ApiServer.API + "/assets", ctx -> {
            User user = AuthGuard.requireUser(api, ctx);
            ArrayNode arr = om.createArrayNode();
            if (user.orgId() != null) {
                for (Site s : svc.sites().listForOrg(user.orgId())) {
                    ObjectNode row = arr.addObject();
                    row.put("id", s.id().toString());
                    row.put("name", s.name());
                    row.put("lat", s.lat());
                    row.put("lon", s.lon());
                    row.put("grid_id", s.gridId());
                    row.set("metadata", s.metadataJson() == null ? om.createObjectNode()
                            : om.readTree(s.metadataJson()));
                    row.put("created_at", s.createdAt());
                }
            }
            ctx.json(arr);
        });

        app.get(ApiServer.API + "/assets/{site_id}/risk", ctx -> {
            User user = AuthGuard.requireUser(api, ctx);
            UUID siteId = ApiServer.parseUuid(ctx.pathParam("site_id"));
            Site site = siteId == null || user.orgId() == null ? null
                    : svc.sites().findForOrg(siteId, user.orgId());
            if (site == null) {
                throw ApiException.notFound("Site not found");
            }
            int horizon = ApiServer.parseInt(ctx.queryParam("horizon_hours"), 24, 1, 72);
            ctx.json(svc.risk().siteRisk(site, horizon));
        });
    }
}
