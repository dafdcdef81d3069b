package com.tarterware.devicewatch.components;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Owns the {@link DeviceBuffer} of every device seen by this instance. Buffers
 * are created lazily on the first write for a device and are kept for the
 * lifetime of the process.
 */
@Component
public class BufferRegistry
{
    // DeviceBuffer by device ID.
    private final ConcurrentMap<String, DeviceBuffer> buffers = new ConcurrentHashMap<String, DeviceBuffer>();

    // Capacity of every buffer created by this registry.
    private final int bufferCapacity;

    private static final Logger logger = LoggerFactory.getLogger(BufferRegistry.class);

    /**
     * @param bufferCapacity the number of measurements each device buffer retains
     * @throws IllegalArgumentException if bufferCapacity is less than 1
     */
    public BufferRegistry(@Value("${com.tarterware.devicewatch.buffer-capacity:1000}") int bufferCapacity)
    {
        if (bufferCapacity < 1)
        {
            throw new IllegalArgumentException("Buffer capacity must be at least 1");
        }
        this.bufferCapacity = bufferCapacity;
    }

    /**
     * Returns the buffer for a device, creating it if this is the first time the
     * device is seen. Concurrent callers for the same new device all receive the
     * same instance.
     *
     * @param deviceId the device ID
     * @return the device's buffer
     */
    public DeviceBuffer getOrCreate(String deviceId)
    {
        return buffers.computeIfAbsent(deviceId, id ->
        {
            logger.debug("Creating buffer for device {}", id);
            return new DeviceBuffer(id, bufferCapacity);
        });
    }

    /**
     * Looks up the buffer for a device without creating one.
     *
     * @param deviceId the device ID
     * @return the buffer, or empty if the device has never been written to
     */
    public Optional<DeviceBuffer> find(String deviceId)
    {
        return Optional.ofNullable(buffers.get(deviceId));
    }

    /**
     * Gets the number of devices tracked.
     */
    public int size()
    {
        return buffers.size();
    }

    public int getBufferCapacity()
    {
        return bufferCapacity;
    }
}
