package at.sv.gateway.api.hass;

public final class HassApiUtils {
    private HassApiUtils() {
    }

    /**
     * @return the part of the entity id before the first '.', or null if the id has no separator
     */
    public static String getDomain(String entityId) {
        int separatorIndex = getSeparatorIndex(entityId);
        if (separatorIndex == -1) {
            return null;
        }
        return entityId.substring(0, separatorIndex);
    }

    /**
     * @return the part of the entity id after the first '.', or null if the id has no separator
     */
    public static String getObjectId(String entityId) {
        int separatorIndex = getSeparatorIndex(entityId);
        if (separatorIndex == -1) {
            return null;
        }
        return entityId.substring(separatorIndex + 1);
    }

    private static int getSeparatorIndex(String entityId) {
        if (entityId == null) {
            return -1;
        }
        return entityId.indexOf('.');
    }
}
