package protocol;

import exceptions.FrameParserException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Arrays;

/**
 * Session metadata that the server sends in the open frame. Fields are comprised of:
 * <p> String sessionId, id given to this connection by the server.
 * <p> String[] upgrades, transports the server could upgrade to.
 * <p> int pingInterval, interval (milliseconds) of the server's heartbeat, 0 if not announced.
 * <p> int pingTimeout, how long (milliseconds) the server waits for a pong, 0 if not announced.
 * <p>
 * Only the presence of a JSON object is required. Servers vary in what they put into it,
 *  so every field is optional and used for diagnostics only.
 */
public class SessionInfo {

    private final String sessionId;
    private final String[] upgrades;
    private final int pingInterval;
    private final int pingTimeout;

    private SessionInfo(String sessionId, String[] upgrades, int pingInterval, int pingTimeout) {
        this.sessionId = sessionId;
        this.upgrades = upgrades;
        this.pingInterval = pingInterval;
        this.pingTimeout = pingTimeout;
    }

    /**
     * @param data JSON text that followed the open frame's type character.
     * @throws FrameParserException if the data isn't a JSON object.
     */
    public static SessionInfo parse(String data) {
        try {
            JSONObject json = new JSONObject(data);

            JSONArray upgradesArray = json.optJSONArray("upgrades");
            String[] upgrades = new String[upgradesArray == null ? 0 : upgradesArray.length()];
            for(int i = 0; i < upgrades.length; i++)
                upgrades[i] = upgradesArray.optString(i);

            return new SessionInfo(json.optString("sid", null),
                                    upgrades,
                                    json.optInt("pingInterval", 0),
                                    json.optInt("pingTimeout", 0));
        } catch(JSONException e) {
            throw new FrameParserException("Error while parsing session info=" + data, e);
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public String[] getUpgrades() {
        return upgrades.clone();
    }

    public int getPingInterval() {
        return pingInterval;
    }

    public int getPingTimeout() {
        return pingTimeout;
    }

    @Override
    public String toString() {
        return "SessionInfo{" +
                "sessionId='" + sessionId + '\'' +
                ", upgrades=" + Arrays.toString(upgrades) +
                ", pingInterval=" + pingInterval +
                ", pingTimeout=" + pingTimeout +
                '}';
    }
}
