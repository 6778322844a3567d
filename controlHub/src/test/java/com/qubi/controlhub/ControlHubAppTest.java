package com.qubi.controlhub;

import com.qubi.controlhub.core.model.CombinedModel;
import com.qubi.controlhub.core.model.JsonSupport;
import com.qubi.controlhub.core.model.RecognitionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ControlHubAppTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private Path components;

    @BeforeEach
    void setUp() throws Exception {
        components = dir.resolve("components.yaml");
        Files.writeString(components, """
                components:
                  Okta:
                    aka: [okta]
                  Splunk:
                not_components: [Chicken]
                """);
    }

    private String run(String... args) {
        StringWriter out = new StringWriter();
        assertEquals(0, new ControlHubApp(out, CLOCK).run(args), String.join(" ", args));
        return out.toString();
    }

    private Path recognized(String name, String content) throws Exception {
        Path ssp = dir.resolve(name + ".psv");
        Files.writeString(ssp, content);
        Path artifact = dir.resolve(name + ".json");
        Files.writeString(artifact, run("match", "--components=" + components, ssp.toString()));
        return artifact;
    }

    @Test
    void matchCombineSelect() throws Exception {
        Path a = recognized("ssp-a", "AC-1 | Okta enforces the policy\nAC-2 | Nobody knows\n");
        Path b = recognized("ssp-b", "AC-1 | Splunk keeps the audit trail\n");

        RecognitionResult artifact = JsonSupport.read(a, RecognitionResult.class);
        assertEquals("NIST_SP-800-53_rev4", artifact.metadata().catalog());
        assertTrue(OffsetDateTime.parse("2024-05-01T12:00:00Z").isEqual(artifact.metadata().created()), "fecha: " + artifact.metadata().created());
        assertTrue(artifact.components().containsKey("UNKNOWN"));

        Path combined = dir.resolve("combined.json");
        Files.writeString(combined, run("combine", a.toString(), b.toString()));
        CombinedModel model = JsonSupport.read(combined, CombinedModel.class);
        assertEquals(2, model.metadata().size());
        assertEquals(1, model.controls("Splunk", "NIST_SP-800-53_rev4").size());

        Path spec = dir.resolve("selectors.yaml");
        Files.writeString(spec, """
                selectors:
                  audit:
                    NIST_SP-800-53_rev4: [AC-1, AU-2]
                """);
        String summary = run("select", "--summary", spec.toString(), combined.toString());
        assertTrue(summary.contains("+AC-1 | -AU-2"), summary);

        Path reports = dir.resolve("reports");
        run("select", "--output-dir=" + reports, spec.toString(), combined.toString());
        assertTrue(Files.exists(reports.resolve("audit.json")));
    }

    @Test
    void assembleWritesBatches() throws Exception {
        Path a = recognized("ssp-a", "AC-1 | Okta and Splunk\n");
        Path combined = dir.resolve("combined.json");
        Files.writeString(combined, run("combine", a.toString()));
        Path out = dir.resolve("batches");

        run("assemble", "--title=Demo", "--batch-size=1", "--batch-output=" + out, combined.toString());

        try (Stream<Path> files = Files.list(out)) {
            assertEquals(2, files.count());
        }
        assertTrue(Files.readString(out.resolve("COMPONENTS-BATCH-0.json")).contains("\"title\" : \"Demo: 0\""));
        assertTrue(run("assemble", "--title=Demo", "--component=Okta", combined.toString()).contains("\"Okta\""));
    }

    @Test
    void convertAndCollate() throws Exception {
        Path vendor = dir.resolve("vendor.psv");
        Files.writeString(vendor, "AC-1 | Vendor text\n");
        Path agency = dir.resolve("agency.psv");
        Files.writeString(agency, "AC-1 | Agency text\n");

        assertEquals("AC-1,Vendor text\n", run("convert", "--format=csv", vendor.toString()));
        String collated = run("collate", "vendor=" + vendor, "agency=" + agency);
        assertTrue(collated.indexOf("Vendor text") < collated.indexOf("Agency text"), collated);
    }

    @Test
    void failuresGiveNonZeroExitCode() throws Exception {
        StringWriter out = new StringWriter();
        ControlHubApp app = new ControlHubApp(out, CLOCK);

        assertEquals(1, app.run(new String[]{}));
        assertEquals(1, app.run(new String[]{"frobnicate"}));
        assertEquals(1, app.run(new String[]{"match", "x.psv"}));
        assertEquals(1, app.run(new String[]{"recognize", "--catalog=ISO", "x.psv"}));
        assertEquals(2, app.run(new String[]{"convert", dir.resolve("missing.psv").toString()}));
        assertEquals(1, app.run(new String[]{"collate", "a=" + dir.resolve("x"), "a=" + dir.resolve("y")}));
    }

    @Test
    void slugs() {
        assertEquals("moderate-baseline", ControlHubApp.slug("Moderate Baseline!"));
        assertEquals("selector", ControlHubApp.slug("***"));
    }
}
