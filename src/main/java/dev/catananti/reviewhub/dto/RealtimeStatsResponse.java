package dev.catananti.reviewhub.dto;

import dev.catananti.reviewhub.comment.RoomStats;
import dev.catananti.reviewhub.notification.ConnectionInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeStatsResponse {

    private boolean accepting;
    private int notificationConnections;
    private List<ConnectionInfo> connections;
    private int commentRooms;
    private int commentMembers;
    private List<RoomStats> rooms;
}
