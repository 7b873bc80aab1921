package com.climaterisklens;

import com.climaterisklens.db.HazardRepo;
import com.climaterisklens.db.HazardRepo.Prediction;
import com.climaterisklens.db.OrganizationRepo;
import com.climaterisklens.db.SiteRepo;
import com.climaterisklens.db.SiteRepo.NewSite;
import com.climaterisklens.db.TelemetryRepo;
import com.climaterisklens.db.UserRepo;
import com.climaterisklens.geo.GridSystem;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DemoSeederTest {
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    OrganizationRepo orgs;
    @Mock
    UserRepo users;
    @Mock
    SiteRepo sites;
    @Mock
    HazardRepo hazards;
    @Mock
    TelemetryRepo telemetry;

    @Test
    @SuppressWarnings("unchecked")
    void seedsOrgSitesPredictionsAndTelemetry() throws Exception {
        UUID orgId = UUID.randomUUID();
        when(orgs.create(DemoSeeder.ORG_NAME, DemoSeeder.ORG_API_KEY)).thenReturn(orgId);
        when(sites.insertAll(eq(orgId), anyList(), anyString())).thenAnswer(inv -> {
            List<UUID> ids = new ArrayList<>();
            for (Object ignored : (List<Object>) inv.getArgument(1)) {
                ids.add(UUID.randomUUID());
            }
            return ids;
        });
        when(hazards.insertAll(anyList())).thenAnswer(inv -> ((List<Object>) inv.getArgument(0)).size());

        GridSystem grid = new GridSystem(1.0);
        DemoSeeder seeder = new DemoSeeder(orgs, users, sites, hazards, telemetry, grid, new ObjectMapper(),
                new Random(1), Clock.fixed(NOW, ZoneOffset.UTC));

        DemoSeeder.Summary s = seeder.seed();

        verify(users).upsertWithRole(DemoSeeder.ADMIN_EMAIL, "admin", orgId);

        ArgumentCaptor<List<NewSite>> siteCaptor = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<String> meta = ArgumentCaptor.forClass(String.class);
        verify(sites).insertAll(eq(orgId), siteCaptor.capture(), meta.capture());
        Set<String> gridIds = new HashSet<>();
        for (NewSite site : siteCaptor.getValue()) {
            assertThat(site.gridId(), is(grid.pointToGridId(site.lat(), site.lon())));
            gridIds.add(site.gridId());
        }
        assertThat(meta.getValue(), containsString("\"demo\":true"));

        ArgumentCaptor<List<Prediction>> preds = ArgumentCaptor.forClass(List.class);
        verify(hazards).insertAll(preds.capture());
        assertThat(preds.getValue().size(), is(gridIds.size() * 4 * 5));
        for (Prediction p : preds.getValue()) {
            assertThat(gridIds.contains(p.gridId()), is(true));
            assertThat(p.issuedAt(), is(NOW));
        }

        verify(telemetry, times(40)).insert(anyString(), any(Instant.class), anyDouble(), anyDouble(), anyString(),
                anyInt());
        assertThat(s.orgId(), is(orgId));
        assertThat(s.sites(), is(DemoSeeder.SITES.size()));
        assertThat(s.predictions(), is(gridIds.size() * 20));
        assertThat(s.telemetry(), is(40));
    }
}
