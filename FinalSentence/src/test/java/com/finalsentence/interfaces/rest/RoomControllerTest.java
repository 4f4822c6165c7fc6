package com.finalsentence.interfaces.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.finalsentence.application.GameService;
import com.finalsentence.domain.PlayerSnapshot;
import com.finalsentence.domain.PlayerStats;
import com.finalsentence.domain.PlayerStatus;
import com.finalsentence.domain.RoomKind;
import com.finalsentence.domain.RoomSnapshot;
import com.finalsentence.domain.RoomStatus;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class RoomControllerTest {
  private static final RoomSnapshot ROOM =
      new RoomSnapshot(
          "room_1",
          "K7Q2ZP",
          RoomKind.PRIVATE,
          RoomStatus.WAITING,
          "h",
          4,
          0,
          45,
          null,
          null,
          List.of(
              new PlayerSnapshot(
                  "h", "Host", "default", PlayerStatus.CONNECTED, 0, 0, 0, true, null)));

  private final GameService game = mock(GameService.class);
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    mvc =
        MockMvcBuilders.standaloneSetup(
                new RoomController(game), new ConfigController(2, 10, 45, 3, 25))
            .setControllerAdvice(new RestExceptionHandler())
            .build();
  }

  @Test
  void createReturnsRoomState() throws Exception {
    when(game.createRoom("h", "Host", RoomKind.PRIVATE, 4)).thenReturn(ROOM);

    mvc.perform(
            post("/rooms")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"hostId\":\"h\",\"hostName\":\"Host\","
                        + "\"kind\":\"PRIVATE\",\"maxPlayers\":4}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.type").value("room_state"))
        .andExpect(jsonPath("$.code").value("K7Q2ZP"))
        .andExpect(jsonPath("$.kind").value("private"))
        .andExpect(jsonPath("$.players[0].status").value("connected"))
        .andExpect(jsonPath("$.players[0].avatar").value("default"));
  }

  @Test
  void joinPassesAvatarThrough() throws Exception {
    when(game.joinByCode("K7Q2ZP", "p", "Pia", "fox")).thenReturn(ROOM);

    mvc.perform(
            post("/rooms/join")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"code\":\"K7Q2ZP\",\"playerId\":\"p\","
                        + "\"displayName\":\"Pia\",\"avatar\":\"fox\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.type").value("room_state"));
  }

  @Test
  void createWithoutHostIsBadRequest() throws Exception {
    mvc.perform(
            post("/rooms").contentType(MediaType.APPLICATION_JSON).content("{\"hostName\":\"x\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("error"));
  }

  @Test
  void capacityOutOfRangeIsBadRequest() throws Exception {
    when(game.createRoom(any(), any(), any(), eq(50)))
        .thenThrow(new IllegalArgumentException("maxPlayers must be between 2 and 10"));

    mvc.perform(
            post("/rooms")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"hostId\":\"h\",\"hostName\":\"Host\",\"maxPlayers\":50}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("maxPlayers must be between 2 and 10"));
  }

  @Test
  void joinUnknownCodeIsNotFound() throws Exception {
    when(game.joinByCode("NOPE00", "p", "Pia", null))
        .thenThrow(new NoSuchElementException("Room not found"));

    mvc.perform(
            post("/rooms/join")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"NOPE00\",\"playerId\":\"p\",\"displayName\":\"Pia\"}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Room not found"));
  }

  @Test
  void joinFullRoomIsConflict() throws Exception {
    when(game.joinByCode("K7Q2ZP", "p", "Pia", null))
        .thenThrow(new IllegalStateException("Room full"));

    mvc.perform(
            post("/rooms/join")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\":\"K7Q2ZP\",\"playerId\":\"p\",\"displayName\":\"Pia\"}"))
        .andExpect(status().isConflict());
  }

  @Test
  void getRoomAndStats() throws Exception {
    when(game.snapshot("room_1")).thenReturn(ROOM);
    when(game.stats("h")).thenReturn(new PlayerStats("h", "Host", 3, 2, 41.5, 60.0, 1));

    mvc.perform(get("/rooms/room_1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.roomId").value("room_1"))
        .andExpect(jsonPath("$.status").value("waiting"));
    mvc.perform(get("/players/h/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.gamesWon").value(2))
        .andExpect(jsonPath("$.avgWpm").value(41.5));
  }

  @Test
  void configExposesGameRules() throws Exception {
    mvc.perform(get("/config"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.minPlayers").value(2))
        .andExpect(jsonPath("$.maxErrors").value(3))
        .andExpect(jsonPath("$.reconnectGraceSeconds").value(25));
  }
}
