package com.octate.collab.rest;

import com.octate.collab.room.RoomManager;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

@QuarkusTest
class RoomResourceTest {

    private static final String ROOM = "rest-room";

    @Inject
    RoomManager roomManager;

    @BeforeEach
    void createRoom() {
        roomManager.createRoom(ROOM, "Notes", "alice", "Alice");
        roomManager.joinRoom(ROOM, "bob", "Bob");
    }

    @AfterEach
    void closeRoom() {
        roomManager.closeRoom(ROOM);
    }

    @Test
    void listsRooms() {
        given()
            .when().get("/rooms")
            .then()
            .statusCode(200)
            .body("rooms.roomId", hasItem(ROOM))
            .body("count", notNullValue());
    }

    @Test
    void showsRoomDetail() {
        given()
            .when().get("/rooms/" + ROOM)
            .then()
            .statusCode(200)
            .body("metadata.hostId", is("alice"))
            .body("metadata.state", is("active"))
            .body("peers.size()", is(2))
            .body("peers[0].isHost", is(true))
            .body("stats.operationCount", is(0));
    }

    @Test
    void showsRoomStats() {
        given()
            .when().get("/rooms/" + ROOM + "/stats")
            .then()
            .statusCode(200)
            .body("roomId", is(ROOM))
            .body("peerCount", is(2))
            .body("bandwidth.sent", notNullValue());
    }

    @Test
    void listsPeers() {
        given()
            .when().get("/rooms/" + ROOM + "/peers")
            .then()
            .statusCode(200)
            .body("peerCount", is(2))
            .body("peers.userId", hasItem("bob"));
    }

    @Test
    void unknownRoomIsNotFound() {
        for (String path : new String[] {"/rooms/missing", "/rooms/missing/stats", "/rooms/missing/peers"}) {
            given()
                .when().get(path)
                .then()
                .statusCode(404)
                .body("error", is("Room not found"));
        }
    }
}
