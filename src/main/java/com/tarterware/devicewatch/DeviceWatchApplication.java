package com.tarterware.devicewatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeviceWatchApplication
{
    public static void main(String[] args)
    {
        SpringApplication.run(DeviceWatchApplication.class, args);
    }
}
