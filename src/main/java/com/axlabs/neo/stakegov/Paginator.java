package com.axlabs.neo.stakegov;

import io.neow3j.devpack.List;

/**
 * Utility for paging through the proposals, whose IDs run from 1 to the proposal count.
 */
public class Paginator {

    /**
     * Calculates which proposal IDs are on a page.
     *
     * @param n            The number of proposals.
     * @param page         The desired page, starting at 0.
     * @param itemsPerPage The desired number of proposals per page.
     * @return the first ID on the page, the ID after the last one on the page, and the total number of pages. The
     * page is empty if both IDs are equal.
     * @throws Exception if the page is out of bounds.
     */
    static int[] calcPagination(int n, int page, int itemsPerPage) throws Exception {
        int pages = n / itemsPerPage;
        if (n % itemsPerPage != 0) {
            pages += 1;
        }
        if (pages == 0) {
            pages = 1; // An empty registry still has one (empty) page.
        }
        if (page >= pages) throw new Exception("[Paginator.calcPagination] Page out of bounds");
        int firstId = itemsPerPage * page + 1;
        int endId = firstId + itemsPerPage;
        if (endId > n + 1) {
            endId = n + 1;
        }
        return new int[]{firstId, endId, pages};
    }

    /**
     * Struct used to return a page of proposals together with the page number and the total number of pages.
     */
    static class Paginated {
        public int page;
        public int pages;
        public List<Object> items;

        public Paginated(int page, int pages, List<Object> items) {
            this.page = page;
            this.pages = pages;
            this.items = items;
        }
    }
}
