package com.wis2.downloader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Wis2DownloaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(Wis2DownloaderApplication.class, args);
    }
}
