package smartaqms.compute.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import smartaqms.compute.AbstractStoreIntegrationTest;
import smartaqms.compute.entity.ReadingEntity;

import java.time.format.DateTimeFormatter;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ReadingControllerTest extends AbstractStoreIntegrationTest {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testIngestBatchReportsRejections() throws Exception {
        station("ST001", "Downtown");
        String ts = now().minusMinutes(1).format(TS);
        String body = String.format("""
                [
                  {"stationId": "ST001", "sensorId": "ST001-S1", "timestamp": "%s",
                   "values": {"PM25": 12.5, "CO2": 430, "TEMPERATURE": 19.5, "HUMIDITY": 58, "WIND_SPEED": 2.1},
                   "confidence": 0.95},
                  {"stationId": "ST001", "sensorId": "ST001-S2", "timestamp": "%s",
                   "values": {"PM25": 12.5, "CO2": 430, "TEMPERATURE": 19.5, "HUMIDITY": 150, "WIND_SPEED": 2.1}}
                ]
                """, ts, ts);

        mockMvc.perform(post("/api/readings/batch").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(1))
                .andExpect(jsonPath("$.rejected").value(1))
                .andExpect(jsonPath("$.rejections[0].field").value("HUMIDITY"));

        mockMvc.perform(get("/api/readings/station/ST001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].sensorId").value("ST001-S1"));
    }

    @Test
    void testQuantityKeysAreCaseInsensitive() throws Exception {
        station("ST001", "Downtown");
        String body = String.format("""
                [
                  {"stationId": "ST001", "sensorId": "ST001-S1", "timestamp": "%s",
                   "values": {"pm25": 12.5, "co2": 430, "temperature": 19.5, "Humidity": 58, "wind_speed": 2.1}}
                ]
                """, now().minusMinutes(1).format(TS));

        mockMvc.perform(post("/api/readings/batch").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(1))
                .andExpect(jsonPath("$.rejected").value(0));
    }

    @Test
    void testUnknownQuantityRejectsOnlyThatReading() throws Exception {
        station("ST001", "Downtown");
        String ts = now().minusMinutes(1).format(TS);
        String body = String.format("""
                [
                  {"stationId": "ST001", "sensorId": "ST001-S1", "timestamp": "%s",
                   "values": {"PM25": 12.5, "CO2": 430, "TEMPERATURE": 19.5, "HUMIDITY": 58, "WIND_SPEED": 2.1}},
                  {"stationId": "ST001", "sensorId": "ST001-S2", "timestamp": "%s",
                   "values": {"PM25": 12.5, "CO2": 430, "TEMPERATURE": 19.5, "HUMIDITY": 58, "WIND_SPEED": 2.1,
                              "BENZENE": 0.4}}
                ]
                """, ts, ts);

        mockMvc.perform(post("/api/readings/batch").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(1))
                .andExpect(jsonPath("$.rejected").value(1))
                .andExpect(jsonPath("$.rejections[0].index").value(1))
                .andExpect(jsonPath("$.rejections[0].field").value("values"));
    }

    @Test
    void testPredictionLookupForUnscoredReadingIsNotFound() throws Exception {
        station("ST001", "Downtown");
        ReadingEntity reading = reading("ST001", now().minusMinutes(2), 20.0);

        mockMvc.perform(get("/api/predictions/reading/" + reading.getId()))
                .andExpect(status().isNotFound());
    }

    @Test
    void testMalformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/readings/batch").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest());
    }
}
