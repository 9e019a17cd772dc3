package com.tarterware.drillpath;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DrillpathApplication
{
    public static void main(String[] args)
    {
        SpringApplication.run(DrillpathApplication.class, args);
    }
}
